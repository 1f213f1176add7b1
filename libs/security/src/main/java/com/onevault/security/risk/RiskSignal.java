package com.onevault.security.risk;

import com.onevault.identity.HashKey;

/**
 * One source of risk, scored in [0, 100] where 100 is the worst case.
 *
 * <p>A source may throw or return a value outside [0, 100]; {@link RiskEngine} then scores it
 * 100, so a broken source makes decisions stricter rather than failing them.
 */
public interface RiskSignal {

    RiskSignalType type();

    double score(HashKey actor, RiskContext context);

    /** Called after a request passed, so history-based sources can learn what is normal. */
    default void recordSuccess(HashKey actor, RiskContext context) {
        // stateless sources keep no history
    }
}
