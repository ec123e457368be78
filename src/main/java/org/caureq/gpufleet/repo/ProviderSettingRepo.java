package org.caureq.gpufleet.repo;

import org.caureq.gpufleet.domain.ProviderSetting;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/** Read-only view: settings are written by the external settings API. */
public interface ProviderSettingRepo extends Repository<ProviderSetting, Long> {
    Optional<ProviderSetting> findByProviderAndSettingKey(String provider, String settingKey);
    List<ProviderSetting> findByProvider(String provider);
}
