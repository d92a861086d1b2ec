package com.chicu.streamcore.compression;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CompressionRunRepository extends JpaRepository<CompressionRunEntity, Long> {

    Optional<CompressionRunEntity> findFirstByOrderByRunAtDesc();
}
