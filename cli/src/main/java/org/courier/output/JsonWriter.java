package org.courier.output;

public non-sealed interface JsonWriter extends OutputWriter {

    void write(final Object object);
}
