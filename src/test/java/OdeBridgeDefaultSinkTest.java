import com.odebridge.ConversionResult;
import com.odebridge.OdeBridge;
import com.odebridge.debug.Debug;
import com.odebridge.debug.DebugLevel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

// never installs a sink: conversions must work against the hub's default
public class OdeBridgeDefaultSinkTest {

    @Test
    void defaultSink_isPresent_andSilent() {
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));
        Debug.get().e("odebridge.test", "dropped");
    }

    @Test
    void convert_withoutHostSink_succeeds() {
        ConversionResult result = new OdeBridge().convert("pools.m", OdeBridgeExtractorTest.TWO_POOLS);
        assertTrue(result.isSuccess(), result::toString);
        assertEquals(4, result.model().reactions().size());
    }

    @Test
    void failedConvert_withoutHostSink_reportsError() {
        ConversionResult result = new OdeBridge().convert("x.m", "x = 1;\n");
        assertFalse(result.isSuccess());
        assertEquals(1, result.errors().size());
    }
}
