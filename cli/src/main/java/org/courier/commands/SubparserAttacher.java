package org.courier.commands;

import net.sourceforge.argparse4j.inf.Subparser;

public interface SubparserAttacher {

    void attachToSubparser(Subparser subparser);
}
