import org.junit.jupiter.api.Test;

import com.panini.script.parser.Value;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    void numberDisplay() {
        assertEquals("5", Value.number(5.0).toString());
        assertEquals("-3", Value.number(-3).toString());
        assertEquals("0.1", Value.number(0.1).toString());
        assertEquals("2.5", Value.number(2.5).toString());
        assertEquals("1000000000000000000000", Value.number(1e21).toString());
        assertEquals("inf", Value.number(Double.POSITIVE_INFINITY).toString());
        assertEquals("NaN", Value.number(Double.NaN).toString());
        assertEquals("-0", Value.number(-0.0).toString());
    }

    @Test
    void numberDisplay_isShortestRoundTrip() {
        assertEquals("282879384806159000", Value.number(2.82879384806159E17).toString());
        assertEquals("0.30000000000000004", Value.number(0.1 + 0.2).toString());
        assertEquals("123456789.125", Value.number(123456789.125).toString());
        assertEquals("0.000001", Value.number(1e-6).toString());
    }

    @Test
    void otherDisplays() {
        assertEquals("सत्य", Value.bool(true).toString());
        assertEquals("असत्य", Value.bool(false).toString());
        assertEquals("null", Value.nil().toString());
        assertEquals("[1, a, null]",
                Value.list(List.of(Value.number(1), Value.string("a"), Value.nil())).toString());
    }

    @Test
    void listsAreImmutableCopies() {
        List<Value> items = new ArrayList<>();
        items.add(Value.number(1));
        Value list = Value.list(items);
        items.add(Value.number(2));
        assertEquals(1, list.asList().size());
        assertThrows(UnsupportedOperationException.class, () -> list.asList().add(Value.nil()));
    }

    @Test
    void wrongAccessorThrows() {
        assertThrows(IllegalStateException.class, () -> Value.string("x").asNumber());
        assertThrows(IllegalStateException.class, () -> Value.number(1).asString());
    }

    @Test
    void valueEquality() {
        assertEquals(Value.number(2), Value.number(2.0));
        assertNotEquals(Value.number(1), Value.string("1"));
        assertSame(Value.nil(), Value.nil());
    }
}
