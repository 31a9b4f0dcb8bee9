package com.privguard.core.oracle;

import com.privguard.core.domain.ExpectedOutcome;
import com.privguard.core.domain.Identity;
import com.privguard.core.domain.Operation;
import com.privguard.core.domain.PrivacyGroup;

/**
 * Declares what the platform ought to decide for a call.
 *
 * <p>Implementations must be pure: no I/O and never derived from asking the platform itself,
 * otherwise the expectation and the system under test are the same thing.</p>
 */
@FunctionalInterface
public interface AuthorizationOracle {

    ExpectedOutcome expect(PrivacyGroup group, Identity identity, Operation operation);
}
