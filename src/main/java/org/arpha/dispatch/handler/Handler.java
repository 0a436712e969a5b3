package org.arpha.dispatch.handler;

import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.Response;

/**
 * Uniform calling convention for everything the router dispatches to.
 * Implementations are shared by concurrent dispatches and must not keep
 * per-call state.
 */
@FunctionalInterface
public interface Handler {

    Response call(Request request);
}
