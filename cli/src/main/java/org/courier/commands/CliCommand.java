package org.courier.commands;

public interface CliCommand extends Command, SubparserAttacher {
}
