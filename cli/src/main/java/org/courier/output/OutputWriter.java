package org.courier.output;

public sealed interface OutputWriter permits JsonWriter, PlainTextWriter {
}
