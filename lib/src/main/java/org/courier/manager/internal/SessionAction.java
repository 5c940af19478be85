package org.courier.manager.internal;

import org.courier.manager.helper.Context;

/**
 * Unit of work run on the session thread. Checked exceptions are reported to the caller and leave the state
 * unchanged, unchecked ones halt the session.
 */
@FunctionalInterface
public interface SessionAction<T> {

    T run(Context context) throws Exception;
}
