package com.onevault.identity;

/**
 * Callback invoked after a row is appended to a hub, satellite or link store.
 *
 * <p>Listeners run on the writer's thread after the commit point. A listener that throws does
 * not undo the mutation; stores log and continue.
 */
@FunctionalInterface
public interface MutationListener {

    /** A listener that ignores every mutation. */
    MutationListener NONE = mutation -> { };

    void onMutation(MutationRecord mutation);
}
