package com.blueprint.maven.prompting;

import java.util.HashMap;
import java.util.Map;

/**
 * Answers questions from preset raw values, for batch runs.
 * <p>
 * A question without a preset value gets an empty answer, which selects its default.
 */
public class PresetInputSource implements InputSource {

    private final Map<String, String> presets;

    public PresetInputSource(Map<String, String> presets) {
        this.presets = presets == null ? Map.of() : new HashMap<>(presets);
    }

    @Override
    public String readLine(Question<?> question) {
        return presets.getOrDefault(question.getName(), "");
    }
}
