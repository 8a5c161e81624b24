package org.stellora.runtime.explorer;

/**
 * Decision policy of an explorer.
 * <p>
 * A strategy performs one tick's worth of actions through the given context: any number of
 * harvest, generate and combine actions at the current planet, and at most one move. It must
 * tolerate every {@link org.stellora.runtime.model.RejectionReason} returned by those actions
 * and must return within the tick.
 */
public interface IExplorerStrategy {

    /**
     * Executes one tick.
     *
     * @param ctx Access to the explorer, the galaxy view and planet requests for this tick.
     */
    void step(ExplorerContext ctx);
}
