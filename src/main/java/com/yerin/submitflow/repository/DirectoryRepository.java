package com.yerin.submitflow.repository;

import com.yerin.submitflow.domain.Directory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DirectoryRepository extends JpaRepository<Directory, String> {
    List<Directory> findByActiveTrueOrderByRankAsc(Pageable pageable);
}
