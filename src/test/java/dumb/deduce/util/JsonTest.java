package dumb.deduce.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonTest {

    @Test
    void serializationErrorsPropagate() {
        assertThrows(JsonProcessingException.class, () -> Json.str(new Object()));
    }

    @Test
    void writesNodes() throws Exception {
        var n = Json.node().put("a", 1);
        assertEquals(1, Json.the.readTree(Json.str(n)).get("a").asInt());
    }
}
