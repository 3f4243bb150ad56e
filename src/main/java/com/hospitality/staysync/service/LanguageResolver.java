package com.hospitality.staysync.service;

import com.hospitality.staysync.entity.Language;
import org.springframework.stereotype.Component;

/**
 * Derives a guest's display language from their country code.
 */
@Component
public class LanguageResolver {

    /**
     * @param countryCode country code in any case, may be null
     * @return the mapped language label, or {@link Language#NONE} when the
     *         code is empty or unknown
     */
    public String resolve(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return Language.NONE;
        }

        String normalized = countryCode.trim();
        for (Language language : Language.values()) {
            if (language.getCountryCode().equalsIgnoreCase(normalized)) {
                return language.getLabel();
            }
        }

        return Language.NONE;
    }
}
