package org.courier.output;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PlainTextWriterImplTest {

    @Test
    void indentedLinesAreNested() {
        final var buffer = new StringWriter();
        final var writer = new PlainTextWriterImpl(buffer);

        writer.println("Inbox: {}", 2);
        writer.indent(w -> {
            w.println("first");
            w.indentedWriter().println("detail {}", "x");
        });

        final var nl = System.lineSeparator();
        assertEquals("Inbox: 2" + nl + "  first" + nl + "    detail x" + nl, buffer.toString());
    }
}
