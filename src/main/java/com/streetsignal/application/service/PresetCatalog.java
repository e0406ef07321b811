package com.streetsignal.application.service;

import com.streetsignal.domain.exception.InvalidJobSpecException;
import com.streetsignal.domain.model.PoiFilter;
import com.streetsignal.infrastructure.config.StreetSignalProperties;
import com.streetsignal.infrastructure.config.StreetSignalProperties.Preset;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named POI filters from configuration. The "custom" preset takes the caller's
 * own selectors instead of configured ones.
 */
@Component
public class PresetCatalog {

    public static final String CUSTOM = "custom";

    private final Map<String, Preset> presets;

    public PresetCatalog(StreetSignalProperties properties) {
        this.presets = Collections.unmodifiableMap(new LinkedHashMap<>(properties.getPresets()));
    }

    public Map<String, Preset> getPresets() {
        return presets;
    }

    /**
     * @param presetName preset name, null meaning custom
     * @param customFilter selectors for the custom preset, null meaning all shops
     * @throws InvalidJobSpecException for an unknown preset
     */
    public PoiFilter resolve(String presetName, PoiFilter customFilter) {
        String name = presetName == null || presetName.isBlank()
            ? CUSTOM
            : presetName.trim().toLowerCase(Locale.ROOT);

        if (CUSTOM.equals(name)) {
            return customFilter != null ? customFilter : PoiFilter.allShops();
        }

        Preset preset = presets.get(name);
        if (preset == null) {
            throw new InvalidJobSpecException("Unknown preset: " + presetName);
        }
        return new PoiFilter(preset.isIncludeAllShops(), preset.getShopTypes(), preset.getAmenities(),
            preset.getPropertySelectors());
    }
}
