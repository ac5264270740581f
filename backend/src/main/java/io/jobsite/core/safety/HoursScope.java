package io.jobsite.core.safety;

import java.util.UUID;

/** A company/project pair that has reported hours. */
public record HoursScope(UUID companyId, UUID projectId) {}
