package com.hospitality.staysync.pms;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed lookup of PMS adapters.
 * <p>
 * Every {@link PmsAdapter} bean is registered once all singletons exist, under
 * the key {@code "PMS_" + capitalized vendor name}. Adding a vendor means adding
 * an adapter bean; nothing here changes.
 * <p>
 * Adapters are pulled through an {@link ObjectProvider} because they depend,
 * through the call executor, on this registry.
 */
@Component
@Slf4j
public class PmsAdapterRegistry implements SmartInitializingSingleton {

    static final String KEY_PREFIX = "PMS_";

    private final ObjectProvider<PmsAdapter> adapterProvider;

    private final Map<String, PmsAdapter> adaptersByKey = new ConcurrentHashMap<>();

    public PmsAdapterRegistry(ObjectProvider<PmsAdapter> adapterProvider) {
        this.adapterProvider = adapterProvider;
    }

    @Override
    public void afterSingletonsInstantiated() {
        adapterProvider.orderedStream().forEach(this::register);

        if (adaptersByKey.isEmpty()) {
            log.warn("No PMS adapters found! Make sure adapters are Spring beans implementing PmsAdapter");
        }
        log.info("Registered PMS adapters: {}", adaptersByKey.keySet());
    }

    public void register(PmsAdapter adapter) {
        String key = keyFor(adapter.getName());
        PmsAdapter previous = adaptersByKey.putIfAbsent(key, adapter);
        if (previous != null && previous != adapter) {
            throw new IllegalStateException(String.format(
                    "Duplicate PMS adapter for %s: %s and %s",
                    key, previous.getClass().getName(), adapter.getClass().getName()));
        }
    }

    /**
     * @param pmsName vendor name in any case, e.g. "mews"
     * @return the adapter, or empty if none is registered under that name
     */
    public Optional<PmsAdapter> resolve(String pmsName) {
        if (pmsName == null || pmsName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(adaptersByKey.get(keyFor(pmsName)));
    }

    public List<PmsAdapter> getAdapters() {
        return new ArrayList<>(adaptersByKey.values());
    }

    static String keyFor(String pmsName) {
        String trimmed = pmsName.trim();
        return KEY_PREFIX
                + trimmed.substring(0, 1).toUpperCase(Locale.ROOT)
                + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }
}
