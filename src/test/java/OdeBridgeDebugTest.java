import com.odebridge.OdeBridge;
import com.odebridge.debug.Debug;
import com.odebridge.debug.DebugLevel;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeDebugTest {

    private static final String SHADOWED = String.join("\n",
        "k = 1;",
        "k = 2;",
        "[t, y] = ode45(@f, [0 1], 1);",
        "function dy = f(t, y)",
        "  dy = -k*y;",
        "end",
        "");

    @AfterEach
    void reset() {
        Debug.get().setSink(null);
        Debug.get().setThreshold(null);
    }

    @Test
    void stages_logUnderTheirTags() {
        Debug.Recorder recorder = new Debug.Recorder();
        Debug.get().setSink(recorder);
        assertTrue(new OdeBridge().convert("twice.m", SHADOWED).isSuccess());

        List<String> lines = recorder.lines();
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("WARN [odebridge.extract]") && l.contains("SHADOWED_BINDING")), lines::toString);
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("DEBUG [odebridge.parser]")), lines::toString);
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("INFO [odebridge.engine]")), lines::toString);
    }

    @Test
    void threshold_dropsLowerLevels() {
        Debug.Recorder recorder = new Debug.Recorder();
        Debug.get().setSink(recorder);
        Debug.get().setThreshold(DebugLevel.WARN);
        assertFalse(Debug.get().isEnabled(DebugLevel.INFO));
        new OdeBridge().convert("twice.m", SHADOWED);
        assertFalse(recorder.lines().isEmpty());
        assertTrue(recorder.lines().stream().allMatch(l -> l.startsWith("WARN") || l.startsWith("ERROR")));
    }

    @Test
    void failures_loggedAsErrors() {
        Debug.Recorder recorder = new Debug.Recorder();
        Debug.get().setSink(recorder);
        new OdeBridge().convert("plain.m", "x = 1;\n");
        assertTrue(recorder.lines().stream().anyMatch(l -> l.startsWith("ERROR [odebridge.engine]")));
    }

    @Test
    void nothingEnabled_withoutSink() {
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));
    }

    @Test
    void levelNames_parseCaseInsensitively() {
        assertEquals(DebugLevel.WARN, DebugLevel.parse("warn"));
        assertThrows(IllegalArgumentException.class, () -> DebugLevel.parse("loud"));
    }
}
