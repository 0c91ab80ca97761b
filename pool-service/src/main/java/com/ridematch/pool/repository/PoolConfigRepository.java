package com.ridematch.pool.repository;

import com.ridematch.pool.entity.PoolConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PoolConfigRepository extends JpaRepository<PoolConfig, UUID> {

    Optional<PoolConfig> findFirstByCityIdAndActiveTrue(String cityId);

    Optional<PoolConfig> findFirstByCityIdIsNullAndActiveTrue();
}
