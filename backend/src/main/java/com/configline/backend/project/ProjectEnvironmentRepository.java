package com.configline.backend.project;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProjectEnvironmentRepository extends JpaRepository<ProjectEnvironmentEntity, String> {

    List<ProjectEnvironmentEntity> findByProjectIdOrderByOrderingAsc(String projectId);
}
