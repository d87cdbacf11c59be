package com.astro.continuum.ui;

import com.astro.continuum.service.ProgressListener;
import javafx.application.Platform;
import javafx.beans.property.DoubleProperty;
import javafx.beans.property.ReadOnlyDoubleProperty;
import javafx.beans.property.ReadOnlyStringProperty;
import javafx.beans.property.SimpleDoubleProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;

import java.util.concurrent.Executor;

/**
 * Pasa el progreso del hilo de trabajo al hilo de JavaFX. Las propiedades solo se
 * modifican dentro del executor, asi que se pueden enlazar a un ProgressBar/Label:
 * {@code progressBar.progressProperty().bind(bridge.progressProperty())}.
 */
public class FxProgressBridge implements ProgressListener {

    private final Executor fxExecutor;
    private final DoubleProperty progress = new SimpleDoubleProperty(0);
    private final StringProperty message = new SimpleStringProperty("");

    public FxProgressBridge() {
        this(Platform::runLater);
    }

    public FxProgressBridge(Executor fxExecutor) {
        this.fxExecutor = fxExecutor;
    }

    @Override
    public void onProgress(String text, double fraction) {
        fxExecutor.execute(() -> {
            message.set(text);
            progress.set(fraction);
        });
    }

    @Override
    public void reset() {
        fxExecutor.execute(() -> progress.set(0));
    }

    public ReadOnlyDoubleProperty progressProperty() {
        return progress;
    }

    public ReadOnlyStringProperty messageProperty() {
        return message;
    }
}
