package com.graphgate.config.schema;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.graphgate.config.step.ConstantStep;
import com.graphgate.config.step.HttpMethod;
import com.graphgate.config.step.HttpStep;
import com.graphgate.config.step.ObjPathStep;
import com.graphgate.config.step.Step;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldTest {

    @Test
    void ofType_withoutStepsLeavesPipelineAbsent() {
        Field field = Field.ofType("User");
        assertEquals("User", field.getTypeOf());
        assertNull(field.getSteps());
        assertNull(field.getArgs());
        assertFalse(field.isList());
        assertFalse(field.isRequired());
    }

    @Test
    void modifiers_returnNewValues() {
        Field base = Field.string();
        Field listed = base.asList();
        Field both = listed.asRequired();
        assertFalse(base.isList());
        assertTrue(listed.isList());
        assertFalse(listed.isRequired());
        assertTrue(both.isList());
        assertTrue(both.isRequired());
    }

    @Test
    void compress_falseModifierIsSameAsUnset() {
        Field explicitFalse = new Field("String", false, false, null, null);
        assertEquals(Field.string().compress(), explicitFalse.compress());
    }

    @Test
    void compress_keepsTrueModifiers() {
        Field field = Field.string().asList().asRequired().compress();
        assertTrue(field.isList());
        assertTrue(field.isRequired());
    }

    @Test
    void compress_emptyStepsAndArgsBecomeAbsent() {
        Field field = new Field("String", false, false, List.of(), Map.of());
        Field compressed = field.compress();
        assertNull(compressed.getSteps());
        assertNull(compressed.getArgs());
    }

    @Test
    void compress_processesStepsInOrder() {
        Step http = new HttpStep("/users", HttpMethod.GET, JsonNodeFactory.instance.objectNode(), JsonNodeFactory.instance.arrayNode());
        Step constant = new ConstantStep(JsonNodeFactory.instance.booleanNode(true));
        Step objPath = ObjPathStep.of("name", "profile", "name");
        Step post = HttpStep.of("/users").withMethod(HttpMethod.POST).withInput(JsonNodeFactory.instance.objectNode());

        Field compressed = Field.ofType("User", http, constant, objPath, post).compress();

        assertEquals(List.of(HttpStep.of("/users"), constant, objPath, HttpStep.of("/users").withMethod(HttpMethod.POST)),
                compressed.getSteps());
    }

    @Test
    void compress_isIdempotent() {
        Field field = Field.ofType("User", new HttpStep("/u", HttpMethod.GET, JsonNodeFactory.instance.objectNode(), null))
                .withArg("id", Arg.integer().asRequired())
                .asList();
        Field once = field.compress();
        assertEquals(once, once.compress());
    }

    @Test
    void withArg_addsWithoutChangingOriginal() {
        Field base = Field.string().withArg("a", Arg.string());
        Field extended = base.withArg("b", Arg.bool().asList());
        assertEquals(Map.of("a", Arg.string()), base.getArgs());
        assertEquals(Map.of("a", Arg.string(), "b", Arg.bool().asList()), extended.getArgs());
    }

    @Test
    void arg_compressKeepsModifiers() {
        Arg arg = Arg.ofType("ID").asList().asRequired();
        assertEquals(arg, arg.compress());
        assertEquals(Arg.string(), new Arg("String", false, false).compress());
    }
}
