import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.lux.script.parser.Environment;
import com.lux.script.parser.Value;

public class EnvironmentTest {

    @Test
    void getWalksOutward_localShadowsParent() {
        Environment root = new Environment();
        root.define("a", Value.number(1));
        root.define("shadow", Value.number(10));

        Environment child = root.extend();
        child.define("b", Value.number(2));
        child.define("shadow", Value.number(20));

        assertEquals(2.0, child.get("b").asNumber());
        assertEquals(1.0, child.get("a").asNumber());
        assertEquals(20.0, child.get("shadow").asNumber());
        assertEquals(10.0, root.get("shadow").asNumber());

        assertNull(root.get("b"));
        assertNull(child.get("missing"));
    }

    @Test
    void defineOverwritesInCurrentFrameOnly() {
        Environment root = new Environment();
        root.define("a", Value.number(1));
        root.define("a", Value.number(2));
        assertEquals(2.0, root.get("a").asNumber());

        Environment child = root.extend();
        child.define("a", Value.number(3));
        assertEquals(2.0, root.get("a").asNumber());
    }

    @Test
    void assignUpdatesNearestExistingFrame_notLocalCopy() {
        Environment root = new Environment();
        root.define("i", Value.number(0));
        Environment child = root.extend();

        assertTrue(child.assign("i", Value.number(5)));
        assertEquals(5.0, root.get("i").asNumber());
        assertFalse(child.names().contains("i"));

        assertFalse(child.assign("nope", Value.nil()));
        assertNull(root.get("nope"));
    }

    @Test
    void getAtAndAssignAt_walkExactlyDepthThenFrameLocal() {
        Environment root = new Environment();
        root.define("x", Value.string("root"));
        Environment mid = root.extend();
        Environment leaf = mid.extend();
        leaf.define("x", Value.string("leaf"));

        assertEquals("root", leaf.getAt("x", 2).asString());
        assertEquals("leaf", leaf.getAt("x", 0).asString());
        // frame-local: mid has no x even though root does
        assertNull(leaf.getAt("x", 1));

        assertTrue(leaf.assignAt("x", Value.string("changed"), 2));
        assertEquals("changed", root.get("x").asString());
        assertEquals("leaf", leaf.get("x").asString());

        assertFalse(leaf.assignAt("x", Value.nil(), 1));
    }

    @Test
    void ancestorAndParent() {
        Environment root = new Environment();
        Environment a = root.extend();
        Environment b = a.extend();

        assertSame(b, b.ancestor(0));
        assertSame(a, b.ancestor(1));
        assertSame(root, b.ancestor(2));
        assertNull(b.ancestor(3));
        assertSame(a, b.parent());
        assertNull(root.parent());
    }

    @Test
    void namesInDefinitionOrder() {
        Environment env = new Environment();
        env.define("b", Value.nil());
        env.define("a", Value.nil());
        env.define("c", Value.nil());
        assertEquals(List.of("b", "a", "c"), List.copyOf(env.names()));
    }
}
