package com.netpulse.core.forecast;

import com.netpulse.core.config.AnalyticsConfig;
import com.netpulse.core.config.ConfidenceLevels;
import com.netpulse.core.config.ForecastSettings;
import com.netpulse.core.error.AnalyticsException;
import com.netpulse.core.model.ForecastPoint;
import com.netpulse.core.model.MetricForecast;
import com.netpulse.core.model.MetricSeries;
import com.netpulse.core.model.SamplePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed store of {@link HoltWintersModel}s, one per device and metric.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * A model is created on the first forecast request for its key and lives
 * until the caller discards it with {@link #discard(ForecastKey)},
 * {@link #discardDevice(String)} or {@link #retainOnly(Collection)}. State is
 * held in memory only; losing it costs a retrain, never correctness.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Each key owns a {@link ReentrantLock}. Requests for the same key run one
 * after another; requests for different keys never wait on each other.
 * A request that races with {@code discard} of its own key still completes,
 * its model is simply not retained.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastEngine.class);

    private final ForecastSettings settings;
    private final int minDataPoints;
    private final double zScore;
    private final ConcurrentMap<ForecastKey, ModelSlot> models = new ConcurrentHashMap<>();

    /**
     * @param settings      smoothing and horizon settings; must not be
     *                      {@code null}
     * @param minDataPoints fewest samples a model is trained on
     * @throws IllegalArgumentException if the confidence level is not
     *                                  supported
     */
    public ForecastEngine(ForecastSettings settings, int minDataPoints) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        if (minDataPoints < 2) {
            throw new IllegalArgumentException("minDataPoints must be >= 2, got: " + minDataPoints);
        }
        this.minDataPoints = minDataPoints;
        this.zScore = ConfidenceLevels.zScore(settings.getConfidenceLevel());
    }

    public static ForecastEngine fromConfig(AnalyticsConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new ForecastEngine(config.getForecast(), config.getMinDataPoints());
    }

    // ---------------------------------------------------------------
    // Forecasting
    // ---------------------------------------------------------------

    /**
     * Forecast the configured horizon with a full retrain.
     *
     * @see #forecast(MetricSeries, int, TrainingMode)
     */
    public MetricForecast forecast(MetricSeries series) {
        return forecast(series, settings.getHorizon(), TrainingMode.RETRAIN);
    }

    /**
     * Train or update the model for the series' key and forecast.
     *
     * @param series  history of one device metric; sorted by timestamp here
     *                if needed
     * @param horizon number of steps to forecast
     * @param mode    whether to retrain or to update the existing model
     * @return the forecast with the model's confidence
     * @throws AnalyticsException with {@code INSUFFICIENT_TRAINING_DATA} when
     *                            a fit is needed and the history is shorter
     *                            than {@code max(minDataPoints, seasonalPeriod)}
     */
    public MetricForecast forecast(MetricSeries series, int horizon, TrainingMode mode) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got: " + horizon);
        }

        MetricSeries ordered = series.sortedByTime();
        ForecastKey key = ForecastKey.of(ordered);
        ModelSlot slot = models.computeIfAbsent(key, k -> new ModelSlot());

        slot.lock.lock();
        try {
            HoltWintersModel model = slot.model;
            if (mode == TrainingMode.RETRAIN || model == null) {
                model = trainInto(slot, key, ordered.getPoints());
            } else {
                applyNewSamples(key, model, ordered.getPoints());
            }
            List<ForecastPoint> points = model.forecast(horizon, zScore);
            return new MetricForecast(key.getMetric(), points, model.confidence());
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Feed one sample into an existing model.
     *
     * @return {@code false} when no model exists for {@code key}
     * @throws IllegalArgumentException if the sample is older than the
     *                                  model's last one
     */
    public boolean update(ForecastKey key, SamplePoint point) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(point, "point must not be null");
        ModelSlot slot = models.get(key);
        if (slot == null) {
            return false;
        }
        slot.lock.lock();
        try {
            if (slot.model == null) {
                return false;
            }
            slot.model.update(point);
            return true;
        } finally {
            slot.lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Model lifecycle
    // ---------------------------------------------------------------

    /**
     * @return a copy of the model for {@code key}, if one has been trained
     */
    public Optional<HoltWintersModel> snapshot(ForecastKey key) {
        Objects.requireNonNull(key, "key must not be null");
        ModelSlot slot = models.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            return Optional.ofNullable(slot.model).map(HoltWintersModel::copy);
        } finally {
            slot.lock.unlock();
        }
    }

    public boolean discard(ForecastKey key) {
        Objects.requireNonNull(key, "key must not be null");
        boolean removed = models.remove(key) != null;
        if (removed) {
            LOG.debug("Discarded forecast model {}", key);
        }
        return removed;
    }

    /**
     * Discard every model of one device.
     *
     * @return number of models removed
     */
    public int discardDevice(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        List<ForecastKey> doomed = new ArrayList<>();
        for (ForecastKey key : models.keySet()) {
            if (key.getDeviceId().equals(deviceId)) {
                doomed.add(key);
            }
        }
        int removed = 0;
        for (ForecastKey key : doomed) {
            if (models.remove(key) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("Discarded {} forecast model(s) of device {}", removed, deviceId);
        }
        return removed;
    }

    /**
     * Keep only the models whose key is in {@code active}.
     *
     * @return number of models removed
     */
    public int retainOnly(Collection<ForecastKey> active) {
        Objects.requireNonNull(active, "active must not be null");
        Set<ForecastKey> keep = new HashSet<>(active);
        int before = models.size();
        models.keySet().removeIf(key -> !keep.contains(key));
        int removed = Math.max(0, before - models.size());
        if (removed > 0) {
            LOG.info("Evicted {} inactive forecast model(s)", removed);
        }
        return removed;
    }

    /**
     * @return number of keys holding a trained model
     */
    public int activeModelCount() {
        int count = 0;
        for (ModelSlot slot : models.values()) {
            if (slot.model != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return number of keys with a slot, trained or not
     */
    int slotCount() {
        return models.size();
    }

    public ForecastSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private HoltWintersModel train(ForecastKey key, List<SamplePoint> history) {
        int required = Math.max(minDataPoints, settings.getSeasonalPeriod());
        if (history.size() < required) {
            throw AnalyticsException.insufficientTrainingData(required, history.size());
        }
        HoltWintersModel model = new HoltWintersModel(settings.getAlpha(), settings.getBeta(),
                settings.getGamma(), settings.getSeasonalPeriod(),
                Duration.ofSeconds(settings.getDefaultStepSeconds()));
        model.fit(history);
        LOG.debug("Trained forecast model {}: {}", key, model);
        return model;
    }

    private static void applyNewSamples(ForecastKey key, HoltWintersModel model,
            List<SamplePoint> history) {
        int applied = 0;
        for (SamplePoint point : history) {
            if (point.getTimestamp().isAfter(model.getLastTimestamp())) {
                model.update(point);
                applied++;
            }
        }
        LOG.trace("Applied {} new sample(s) to forecast model {}", applied, key);
    }

    /** Lock plus the model it guards. */
    private HoltWintersModel trainInto(ModelSlot slot, ForecastKey key, List<SamplePoint> points) {
        try {
            HoltWintersModel model = train(key, points);
            slot.model = model;
            return model;
        } catch (AnalyticsException e) {
            // a key that never trained keeps no slot
            if (slot.model == null) {
                models.remove(key, slot);
            }
            throw e;
        }
    }

    private static final class ModelSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile HoltWintersModel model;
    }
}
