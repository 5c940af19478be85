package org.courier.commands;

import org.courier.OutputType;

import java.util.List;

/**
 * A local command that can also print its result as JSON.
 */
public interface JsonOutputCommand extends LocalCommand {

    @Override
    default List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }
}
