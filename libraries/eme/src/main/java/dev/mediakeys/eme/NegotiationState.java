/*
 * Copyright (C) 2024 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mediakeys.eme;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.mediakeys.common.util.Log;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The negotiation state of one attach lifecycle: the key-system entries, the pending media keys,
 * the license failure count and whether keys were applied to the sink.
 *
 * <p>{@link #release()} cancels every future started through {@link #track}. Once released, the
 * state ignores new work.
 */
/* package */ final class NegotiationState {

  private static final String TAG = "NegotiationState";

  private final List<KeySystemEntry> entries;
  private final Set<Future<?>> pendingFutures;

  @Nullable private ListenableFuture<MediaKeys> mediaKeysFuture;
  private int licenseFailureCount;
  private boolean keysApplied;
  private volatile boolean released;

  public NegotiationState() {
    entries = new ArrayList<>();
    pendingFutures = ConcurrentHashMap.newKeySet();
  }

  /** Appends an entry. */
  public void addEntry(KeySystemEntry entry) {
    entries.add(entry);
  }

  /** Returns the entry used for keys and licensing, or null if there is none. */
  @Nullable
  public KeySystemEntry getActiveEntry() {
    return entries.isEmpty() ? null : entries.get(0);
  }

  /** Returns all entries, in the order they were added. */
  public ImmutableList<KeySystemEntry> getEntries() {
    return ImmutableList.copyOf(entries);
  }

  /** Returns the pending media keys, or null if negotiation was not started. */
  @Nullable
  public ListenableFuture<MediaKeys> getMediaKeysFuture() {
    return mediaKeysFuture;
  }

  public void setMediaKeysFuture(ListenableFuture<MediaKeys> mediaKeysFuture) {
    this.mediaKeysFuture = mediaKeysFuture;
  }

  /** Increments the license failure count and returns the new value. */
  public int incrementLicenseFailureCount() {
    return ++licenseFailureCount;
  }

  public void resetLicenseFailureCount() {
    licenseFailureCount = 0;
  }

  public int getLicenseFailureCount() {
    return licenseFailureCount;
  }

  public boolean areKeysApplied() {
    return keysApplied;
  }

  public void setKeysApplied() {
    keysApplied = true;
  }

  public boolean isReleased() {
    return released;
  }

  /**
   * Records a future so that {@link #release()} can cancel it. A future tracked after release is
   * cancelled immediately.
   *
   * @return {@code future}.
   */
  @CanIgnoreReturnValue
  public <T> ListenableFuture<T> track(ListenableFuture<T> future) {
    if (released) {
      future.cancel(/* mayInterruptIfRunning= */ false);
      return future;
    }
    pendingFutures.add(future);
    future.addListener(() -> pendingFutures.remove(future), MoreExecutors.directExecutor());
    return future;
  }

  /** Cancels pending work, closes every key session and clears the entries. */
  public void release() {
    if (released) {
      return;
    }
    released = true;
    for (Future<?> future : ImmutableList.copyOf(pendingFutures)) {
      future.cancel(/* mayInterruptIfRunning= */ false);
    }
    pendingFutures.clear();
    for (KeySystemEntry entry : entries) {
      @Nullable MediaKeySession session = entry.getSession();
      if (session != null) {
        closeSession(session);
      }
    }
    entries.clear();
    mediaKeysFuture = null;
    keysApplied = false;
    licenseFailureCount = 0;
  }

  private static void closeSession(MediaKeySession session) {
    ListenableFuture<Void> closeFuture;
    try {
      closeFuture = session.close();
    } catch (RuntimeException e) {
      Log.e(TAG, "Failed to close key session " + session.getSessionId(), e);
      return;
    }
    Futures.addCallback(
        closeFuture,
        new FutureCallback<Void>() {
          @Override
          public void onSuccess(@Nullable Void result) {
            Log.d(TAG, "Closed key session " + session.getSessionId());
          }

          @Override
          public void onFailure(Throwable t) {
            Log.e(TAG, "Failed to close key session " + session.getSessionId(), t);
          }
        },
        MoreExecutors.directExecutor());
  }
}
