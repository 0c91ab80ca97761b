package com.ridematch.pool.service;

import com.ridematch.pool.config.PoolProperties;
import com.ridematch.pool.entity.PoolConfig;
import com.ridematch.pool.model.PoolSettings;
import com.ridematch.pool.repository.PoolConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Active city row, else active global row, else service defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolSettingsResolver {

    private final PoolConfigRepository poolConfigRepository;
    private final PoolProperties properties;

    public PoolSettings resolve(String cityId) {
        Optional<PoolConfig> config = cityId == null || cityId.isBlank()
                ? Optional.empty()
                : poolConfigRepository.findFirstByCityIdAndActiveTrue(cityId);

        return config
                .or(poolConfigRepository::findFirstByCityIdIsNullAndActiveTrue)
                .map(PoolSettings::from)
                .orElseGet(() -> {
                    log.debug("No active pool config for city {}, using service defaults", cityId);
                    return PoolSettings.from(properties);
                });
    }
}
