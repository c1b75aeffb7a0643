package com.cfoPilot.aiCfo.repository;

import java.util.Optional;

public interface OrgRoleRepository {

    Optional<String> findRole(String orgId, String userId);
}
