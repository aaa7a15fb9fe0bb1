package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.InstanceKey;
import com.mcpbridge.core.model.ServerDefinition;

/**
 * Applies {@link UserLimits} to a creation request.
 */
final class UserLimitsCheck {

    private UserLimitsCheck() {}

    static void enforce(UserLimits limits, InstanceKey key, ServerDefinition definition, int userInstances) {
        if (userInstances >= limits.maxInstances()) {
            throw new AdmissionException(AdmissionException.USER_LIMIT,
                    "User " + key.userId() + " has reached the maximum of " + limits.maxInstances()
                            + " " + key.mode().value() + " instance(s)");
        }
        if (!limits.allowedModes().contains(definition.lifecycle())) {
            throw new AdmissionException(AdmissionException.MODE_NOT_ALLOWED,
                    "User " + key.userId() + " is not allowed to use lifecycle mode " + definition.lifecycle().value());
        }
        Integer requested = definition.resourceLimits().maxMemoryMb();
        if (requested != null && requested > limits.maxMemoryMb()) {
            throw new AdmissionException(AdmissionException.QUOTA,
                    "Requested memory exceeds the quota of user " + key.userId() + ": "
                            + requested + "MB > " + limits.maxMemoryMb() + "MB");
        }
    }
}
