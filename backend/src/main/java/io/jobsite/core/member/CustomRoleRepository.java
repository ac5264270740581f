package io.jobsite.core.member;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CustomRoleRepository extends JpaRepository<CustomRole, UUID> {}
