package com.privguard.core.oracle;

import com.privguard.core.domain.ExpectedOutcome;
import com.privguard.core.domain.Identity;
import com.privguard.core.domain.Operation;
import com.privguard.core.domain.PrivacyGroup;

import java.util.Objects;

/**
 * Default policy: members may read and write, everyone else is refused.
 * Identities on a member's node get no special treatment.
 */
public class MembershipAuthorizationOracle implements AuthorizationOracle {

    @Override
    public ExpectedOutcome expect(PrivacyGroup group, Identity identity, Operation operation) {
        Objects.requireNonNull(group, "Group cannot be null");
        Objects.requireNonNull(identity, "Identity cannot be null");
        Objects.requireNonNull(operation, "Operation cannot be null");
        return group.isMember(identity.name()) ? ExpectedOutcome.ALLOW : ExpectedOutcome.DENY;
    }
}
