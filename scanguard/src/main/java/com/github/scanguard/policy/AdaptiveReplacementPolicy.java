/*
 * Copyright 2026 The ScanGuard Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.scanguard.policy;

import static com.github.scanguard.policy.Segment.FREQUENCY;
import static com.github.scanguard.policy.Segment.RECENCY;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.Var;

/**
 * An adaptive, scan-resistant replacement policy. The resident keys are split into a recency pool
 * and a frequency pool whose balance is tuned online, as in ARC, from misses that hit the history
 * of recently evicted keys. Victims are sampled from the least recently used end of the pool that
 * exceeds its share and scored by a TinyLFU frequency sketch. A run of cold misses is treated as a
 * scan, during which new keys are placed so that they leave first.
 * <p>
 * A key recovered from the history enters the frequency pool, but one that then keeps leaving
 * without ever being hit, as in a loop slightly larger than the cache, is eventually remembered as
 * a recency ghost so that its return grows the recency target instead of shrinking it.
 * <p>
 * The policy is bound to the capacity of its store. If a hook observes a different capacity then
 * the policy logs a warning and resets to an empty state sized for the new capacity. Disagreement
 * between the tracked keys and the store's keys is repaired silently, treating the store as
 * authoritative.
 * <p>
 * <b>This class is not thread-safe.</b> A concurrent store must serialize the hook calls.
 *
 * @param <K> the type of keys
 */
public final class AdaptiveReplacementPolicy<K> implements ReplacementPolicy<K> {
  static final Logger logger = System.getLogger(AdaptiveReplacementPolicy.class.getName());

  private final AdaptiveSettings settings;
  private final int strikeLimit;
  private final Random random;

  private int capacity;
  private ResidentSegments<K> segments;
  private GhostHistory<K> ghosts;
  private FrequencySketch<K> sketch;
  private TargetController controller;
  private ScanDetector scan;
  private VictimSelector<K> selector;
  private AdmissionController<K> admission;

  private @Nullable K pendingKey;
  private @Nullable Segment pendingOrigin;
  private int pendingStrikes;
  private long resyncs;
  private long resets;
  private long tick;

  /** Creates a policy for the capacity using the default settings. */
  public AdaptiveReplacementPolicy(int capacity) {
    this(capacity, AdaptiveSettings.load());
  }

  /** Creates a policy for the capacity whose random choices are seeded by the settings. */
  public AdaptiveReplacementPolicy(int capacity, AdaptiveSettings settings) {
    this(capacity, settings, new Random(settings.randomSeed()));
  }

  /** Creates a policy for the capacity that draws its random choices from the given source. */
  public AdaptiveReplacementPolicy(int capacity, AdaptiveSettings settings, Random random) {
    this.settings = requireNonNull(settings);
    this.strikeLimit = settings.strikeLimit();
    this.random = requireNonNull(random);
    initialize(capacity);
  }

  @Override
  public K selectVictim(StoreView<K> store, K incoming) {
    requireNonNull(incoming);
    checkCapacity(store);
    checkState(store.size() > 0, "Cannot select a victim from an empty store");
    checkState(store.size() >= capacity,
        "Cannot select a victim while the store has room (%s of %s)", store.size(), capacity);
    if (segments.contains(incoming) && !store.contains(incoming)) {
      dropStale(incoming);
    }

    Segment origin = classify(incoming);
    int target = scan.effectiveTarget(controller.target(), tick);
    return selector.select(store, origin, target);
  }

  @Override
  public boolean admit(StoreView<K> store, K incoming, K victim) {
    Segment origin = incoming.equals(pendingKey) ? pendingOrigin : ghosts.originOf(incoming);
    return admission.admit(incoming, origin, victim);
  }

  @Override
  public void onEvicted(StoreView<K> store, K victim) {
    requireNonNull(victim);
    checkCapacity(store);
    int strikes = segments.strikes(victim);
    Segment origin = segments.remove(victim);
    if (origin == null) {
      logger.log(Level.DEBUG, () -> "Evicted key was not tracked: " + victim);
      ghosts.record(victim, RECENCY, tick);
    } else if ((origin == FREQUENCY) && (strikes >= strikeLimit)) {
      ghosts.record(victim, RECENCY, strikes, tick);
    } else {
      ghosts.record(victim, origin, strikes, tick);
    }
    verify(store);
  }

  @Override
  public void onInserted(StoreView<K> store, K key) {
    requireNonNull(key);
    checkCapacity(store);
    if (!key.equals(pendingKey)) {
      classify(key);
    }
    Segment origin = pendingOrigin;
    int strikes = Math.min(strikeLimit, pendingStrikes + 1);
    clearPending();
    ghosts.remove(key);

    if (segments.contains(key)) {
      logger.log(Level.DEBUG, () -> "Inserted key was already tracked: " + key);
      segments.touch(key, tick);
    } else {
      if (segments.isFull()) {
        resync(store);
        segments.remove(key);
      }
      if (segments.isFull()) {
        logger.log(Level.DEBUG, () -> "Store holds more keys than its capacity: " + store.size());
      } else {
        admission.place(key, origin, scan.isGuarded(tick), tick);
        segments.setStrikes(key, strikes);
      }
    }
    verify(store);
  }

  @Override
  public void onRejected(StoreView<K> store, K key) {
    requireNonNull(key);
    checkCapacity(store);
    clearPending();
    if (!store.contains(key)) {
      ghosts.record(key, RECENCY, tick);
    }
    verify(store);
  }

  @Override
  public void onHit(StoreView<K> store, K key) {
    requireNonNull(key);
    checkCapacity(store);
    tick++;
    sketch.increment(key);
    scan.onReuse();

    Segment segment = segments.segmentOf(key);
    if (segment == RECENCY) {
      segments.promote(key, tick);
      segments.setStrikes(key, 0);
    } else if (segment == FREQUENCY) {
      segments.touch(key, tick);
      segments.setStrikes(key, 0);
    } else {
      logger.log(Level.DEBUG, () -> "Hit on an untracked key: " + key);
      ghosts.remove(key);
      if (segments.isFull()) {
        resync(store);
      } else {
        segments.insert(key, RECENCY, tick);
      }
    }
    controller.decayIfIdle(tick);
    verify(store);
  }

  /**
   * Advances the clock for a miss and applies its adaptation: a ghost hit moves the target and
   * ends any scan, while a cold miss extends the scan streak. The outcome is kept as pending until
   * the key is inserted or rejected.
   *
   * @return the ghost list that the key was found in, or null if it is cold
   */
  private @Nullable Segment classify(K key) {
    tick++;
    sketch.increment(key);
    boolean guarded = scan.isGuarded(tick);
    Segment origin = ghosts.originOf(key);
    pendingKey = key;
    pendingOrigin = origin;
    pendingStrikes = ghosts.strikesOf(key);
    if (origin == RECENCY) {
      controller.onRecencyGhostHit(ghosts.size(RECENCY), ghosts.size(FREQUENCY), guarded, tick);
      scan.onReuse();
      ghosts.consume(key);
    } else if (origin == FREQUENCY) {
      controller.onFrequencyGhostHit(ghosts.size(RECENCY), ghosts.size(FREQUENCY), guarded, tick);
      scan.onReuse();
      ghosts.consume(key);
    } else {
      scan.onColdMiss(tick);
      controller.decayIfIdle(tick);
    }
    return origin;
  }

  private void clearPending() {
    pendingKey = null;
    pendingOrigin = null;
    pendingStrikes = 0;
  }

  private void dropStale(K key) {
    logger.log(Level.DEBUG, () -> "Dropped a tracked key that is absent from the store: " + key);
    segments.remove(key);
  }

  /** Resets the policy if the store's capacity differs from the one it was sized for. */
  private void checkCapacity(StoreView<K> store) {
    int reported = store.capacity();
    if (reported != capacity) {
      logger.log(Level.WARNING, "Store capacity changed from {0} to {1}; resetting the policy",
          capacity, reported);
      initialize(reported);
      resets++;
    }
  }

  /** Repairs the tracked keys if their count disagrees with the store. */
  private void verify(StoreView<K> store) {
    if (segments.size() != store.size()) {
      resync(store);
    }
  }

  /**
   * Reconciles the tracked keys with the store by discarding keys the store no longer holds and
   * adopting unknown resident keys into the recency pool.
   */
  private void resync(StoreView<K> store) {
    List<K> stale = new ArrayList<>();
    for (Segment segment : Segment.values()) {
      segments.forEach(segment, key -> {
        if (!store.contains(key)) {
          stale.add(key);
        }
      });
    }
    stale.forEach(segments::remove);

    @Var int adopted = 0;
    for (K key : store.keys()) {
      if (segments.isFull()) {
        break;
      } else if (!segments.contains(key)) {
        ghosts.remove(key);
        segments.insert(key, RECENCY, tick);
        adopted++;
      }
    }
    resyncs++;

    int discarded = stale.size();
    int added = adopted;
    logger.log(Level.DEBUG, () -> String.format(
        "Resynchronized with the store: %d stale, %d adopted", discarded, added));
  }

  private void initialize(int capacity) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
    segments = new ResidentSegments<>(capacity);
    ghosts = new GhostHistory<>(settings.ghostBoundFor(capacity));
    sketch = new FrequencySketch<>(capacity,
        settings.maximumCount(), settings.agePeriodFor(capacity));
    controller = new TargetController(capacity, Math.min(capacity, settings.baselineFor(capacity)),
        settings.stepCapFor(capacity), settings.scanStepCapFor(capacity));
    scan = new ScanDetector(settings.scanThresholdFor(capacity),
        settings.guardWindowFor(capacity), settings.targetReductionFor(capacity));
    selector = new VictimSelector<>(segments, sketch, settings.sampleSizeFor(capacity));
    admission = new AdmissionController<>(settings, capacity, segments, sketch, random);
    clearPending();
    tick = 0;
  }

  /** Returns the capacity that the policy is sized for. */
  public int capacity() {
    return capacity;
  }

  /** Returns the current target size of the recency pool. */
  public int target() {
    return controller.target();
  }

  /** Returns the number of resident keys tracked in the segment. */
  public int segmentSize(Segment segment) {
    return segments.size(segment);
  }

  /** Returns the number of ghost entries that were evicted from the segment. */
  public int ghostSize(Segment origin) {
    return ghosts.size(origin);
  }

  /** Returns the estimated popularity of the key. */
  public int frequency(K key) {
    return sketch.frequency(key);
  }

  /** Returns if a scan is currently suspected. */
  public boolean isScanGuarded() {
    return scan.isGuarded(tick);
  }

  /** Returns the number of candidates that the admission filter declined. */
  public long rejections() {
    return admission.rejections();
  }

  /** Returns the number of times the tracked keys were reconciled with a store. */
  public long resyncs() {
    return resyncs;
  }

  /** Returns the number of full resets due to a change in the store's capacity. */
  public long resets() {
    return resets;
  }

  @Nullable Segment segmentOf(K key) {
    return segments.segmentOf(key);
  }

  @Nullable Segment ghostOriginOf(K key) {
    return ghosts.originOf(key);
  }

  int strikes(K key) {
    return segments.strikes(key);
  }

  ScanDetector.State scanState() {
    return scan.state(tick);
  }

  long ticks() {
    return tick;
  }

  /**
   * Verifies that the tracked state agrees with the store: each resident key is in exactly one
   * pool, no ghost is resident, the history is within its bound and the target is within the
   * capacity.
   *
   * @throws IllegalStateException if an invariant does not hold
   */
  public void checkInvariants(StoreView<K> store) {
    checkState(segments.size() == store.size(),
        "Tracked %s keys but the store holds %s", segments.size(), store.size());
    for (K key : store.keys()) {
      checkState(segments.contains(key), "Resident key is not tracked: %s", key);
      checkState(ghosts.originOf(key) == null, "Resident key is also a ghost: %s", key);
    }
    checkState(ghosts.size() <= ghosts.maximumSize(),
        "History of %s exceeds its bound of %s", ghosts.size(), ghosts.maximumSize());
    checkState((controller.target() >= 0) && (controller.target() <= capacity),
        "Target %s is outside of [0, %s]", controller.target(), capacity);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("capacity", capacity)
        .add("target", controller.target())
        .add("recency", segments.size(RECENCY))
        .add("frequency", segments.size(FREQUENCY))
        .add("recencyGhosts", ghosts.size(RECENCY))
        .add("frequencyGhosts", ghosts.size(FREQUENCY))
        .add("scan", scan.state(tick))
        .toString();
  }
}
