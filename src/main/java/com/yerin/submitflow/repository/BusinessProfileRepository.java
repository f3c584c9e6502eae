package com.yerin.submitflow.repository;

import com.yerin.submitflow.domain.BusinessProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BusinessProfileRepository extends JpaRepository<BusinessProfile, String> {
}
