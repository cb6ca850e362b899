package com.tensorform.ad.util;

import com.tensorform.ad.api.DiagnosticSink;
import com.tensorform.ad.api.DifferentiationException;
import com.tensorform.ad.api.MissingRuleException;
import com.tensorform.ad.api.PreconditionException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class RecordingDiagnosticSinkTest {

    @Test
    public void testRecordsWarnings() {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
        assertTrue(sink.isClean());
        sink.warn("first");
        sink.warn("second");
        assertEquals(List.of("first", "second"), sink.warnings());
        assertFalse(sink.isClean());

        sink.clear();
        assertTrue(sink.isClean());
    }

    @Test
    public void testFailRecordsAndThrows() {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
        PreconditionException error = new PreconditionException("bad operand");
        try {
            sink.fail(error);
            fail("Expected PreconditionException");
        } catch (PreconditionException e) {
            assertSame(error, e);
        }
        assertEquals(List.of(error), sink.errors());
    }

    @Test
    public void testForwardsToDelegate() {
        List<String> seen = new ArrayList<>();
        DiagnosticSink delegate = new DiagnosticSink() {
            @Override
            public void warn(String message) {
                seen.add("warn:" + message);
            }

            @Override
            public void fail(DifferentiationException error) {
                seen.add("fail:" + error.getMessage());
                throw error;
            }
        };
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink(delegate);
        sink.warn("w");
        try {
            sink.fail(new MissingRuleException("no rule"));
            fail("Expected MissingRuleException");
        } catch (MissingRuleException e) {
            assertEquals(List.of("warn:w", "fail:no rule"), seen);
            assertEquals(1, sink.errors().size());
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testViewsAreReadOnly() {
        new RecordingDiagnosticSink().warnings().add("x");
    }

    @Test(expected = PreconditionException.class)
    public void testLoggingSinkThrows() {
        LoggingDiagnosticSink.INSTANCE.warn("logged only");
        LoggingDiagnosticSink.INSTANCE.fail(new PreconditionException("logged and thrown"));
    }
}
