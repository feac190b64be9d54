package com.health.compliance.engine;

import java.util.Set;

/**
 * Read access to the patients a provider is clinically assigned to.
 */
public interface CaseloadDirectory {

    /**
     * @return the provider's patient ids, empty if the provider has no assignments
     */
    Set<String> caseloadOf(String providerId);
}
