package com.sentiment_retraining.unit_tests.service.inference;

import com.sentiment_retraining.dto.registry.ModelVersionDTO;
import com.sentiment_retraining.exception.FileProcessingException;
import com.sentiment_retraining.exception.ModelNotLoadedException;
import com.sentiment_retraining.service.inference.ModelHandle;
import com.sentiment_retraining.service.registry.ProductionModelLoader;
import com.sentiment_retraining.service.registry.ProductionModelLoader.LoadedModel;
import com.sentiment_retraining.service.training.TrainedSentimentModel;
import com.sentiment_retraining.util.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.ZonedDateTime;
import java.util.Optional;

import static com.sentiment_retraining.util.TestSettings.MODEL_NAME;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ModelHandleTest {

    @Mock
    private ProductionModelLoader productionModelLoader;
    @Mock
    private TrainedSentimentModel model;

    private ModelHandle modelHandle;

    @BeforeEach
    void setUp() {
        modelHandle = new ModelHandle(productionModelLoader, TestSettings.defaults());
    }

    @Test
    @DisplayName("Model is loaded once and then served from memory")
    void lazyLoadOnce() {
        when(productionModelLoader.loadProduction(MODEL_NAME)).thenReturn(Optional.of(loaded(3)));

        assertFalse(modelHandle.isLoaded());
        assertEquals(3, modelHandle.get().version().getVersion());
        modelHandle.get();

        assertTrue(modelHandle.isLoaded());
        verify(productionModelLoader, times(1)).loadProduction(MODEL_NAME);
    }

    @Test
    void noProductionModelIsNotLoaded() {
        when(productionModelLoader.loadProduction(MODEL_NAME)).thenReturn(Optional.empty());

        assertThrows(ModelNotLoadedException.class, () -> modelHandle.get());
        assertTrue(modelHandle.peek().isEmpty());
    }

    @Test
    void loaderFailureIsNotLoaded() {
        when(productionModelLoader.loadProduction(MODEL_NAME)).thenThrow(new FileProcessingException("corrupt artifact"));

        ModelNotLoadedException ex = assertThrows(ModelNotLoadedException.class, () -> modelHandle.get());
        assertInstanceOf(FileProcessingException.class, ex.getCause());
    }

    @Test
    @DisplayName("Reload swaps in the newest Production version")
    void reloadSwaps() {
        when(productionModelLoader.loadProduction(MODEL_NAME))
                .thenReturn(Optional.of(loaded(3)))
                .thenReturn(Optional.of(loaded(4)));

        modelHandle.get();
        LoadedModel reloaded = modelHandle.reload();

        assertEquals(4, reloaded.version().getVersion());
        assertEquals(4, modelHandle.get().version().getVersion());
    }

    @Test
    @DisplayName("Failed reload keeps serving the previous model")
    void failedReloadKeepsPrevious() {
        when(productionModelLoader.loadProduction(MODEL_NAME))
                .thenReturn(Optional.of(loaded(3)))
                .thenThrow(new FileProcessingException("storage down"));

        modelHandle.get();

        assertEquals(3, modelHandle.reload().version().getVersion());
        assertTrue(modelHandle.isLoaded());
    }

    @Test
    void reloadWithoutAnyModelFails() {
        when(productionModelLoader.loadProduction(MODEL_NAME)).thenReturn(Optional.empty());

        assertThrows(ModelNotLoadedException.class, () -> modelHandle.reload());
    }

    private LoadedModel loaded(int version) {
        return new LoadedModel(model, ModelVersionDTO.builder().name(MODEL_NAME).version(version).build(), ZonedDateTime.now());
    }
}
