package com.sentiment_retraining.service.inference;

import com.sentiment_retraining.config.PipelineSettings;
import com.sentiment_retraining.exception.ModelNotLoadedException;
import com.sentiment_retraining.service.registry.ProductionModelLoader;
import com.sentiment_retraining.service.registry.ProductionModelLoader.LoadedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Holds the Production model served by the inference endpoints. Loaded lazily on first use and
 * replaced atomically on reload; readers always see either the old or the new model.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelHandle {

    private final ProductionModelLoader productionModelLoader;
    private final PipelineSettings settings;

    private final Object loadLock = new Object();
    private volatile LoadedModel current;

    public boolean isLoaded() {
        return current != null;
    }

    /**
     * @throws ModelNotLoadedException when no Production model is registered or it could not be loaded
     */
    public LoadedModel get() {
        LoadedModel loaded = current;
        if (loaded != null) {
            return loaded;
        }
        synchronized (loadLock) {
            if (current == null) {
                current = load().orElseThrow(() -> new ModelNotLoadedException("No Production model available for '" + settings.getModelName() + "'"));
            }
            return current;
        }
    }

    public Optional<LoadedModel> peek() {
        return Optional.ofNullable(current);
    }

    /**
     * Loads the newest Production version. The previous model keeps serving when nothing new can be loaded.
     */
    public LoadedModel reload() {
        synchronized (loadLock) {
            Optional<LoadedModel> fresh;
            try {
                fresh = load();
            } catch (ModelNotLoadedException e) {
                if (current == null) {
                    throw e;
                }
                log.error("❌ Reload failed; keeping v{}: {}", current.version().getVersion(), e.getMessage());
                return current;
            }
            if (fresh.isEmpty()) {
                if (current == null) {
                    throw new ModelNotLoadedException("No Production model available for '" + settings.getModelName() + "'");
                }
                log.warn("⚠️ No Production model found on reload; keeping v{}", current.version().getVersion());
                return current;
            }
            current = fresh.get();
            log.info("🔄 Serving {} v{}", settings.getModelName(), current.version().getVersion());
            return current;
        }
    }

    private Optional<LoadedModel> load() {
        try {
            return productionModelLoader.loadProduction(settings.getModelName());
        } catch (RuntimeException e) {
            throw new ModelNotLoadedException("Failed to load Production model for '" + settings.getModelName() + "'", e);
        }
    }
}
