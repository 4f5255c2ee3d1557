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

import static dev.mediakeys.common.util.Assertions.checkState;

import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A key system for which access was obtained, together with the CDM handles created from that
 * access. Each handle is set at most once.
 */
public final class KeySystemEntry {

  /** The negotiation state of an entry. */
  public enum State {
    /** Access was obtained and the media keys are being created. */
    KEY_CONTAINER_PENDING,
    /** The key session exists and no license request was generated yet. */
    SESSION_CREATED,
    /** A license request was generated. */
    REQUEST_GENERATED,
    /** Generating the license request failed. */
    REQUEST_FAILED
  }

  /** The key system. */
  public final KeySystem keySystem;

  /** The access handle the entry was created from. */
  public final MediaKeySystemAccess access;

  private @MonotonicNonNull MediaKeys mediaKeys;
  private @MonotonicNonNull MediaKeySession session;
  @Nullable private String keyId;
  private boolean sessionInitialized;
  private State state;

  /* package */ KeySystemEntry(KeySystem keySystem, MediaKeySystemAccess access) {
    this.keySystem = keySystem;
    this.access = access;
    state = State.KEY_CONTAINER_PENDING;
  }

  /** Returns the current state. */
  public State getState() {
    return state;
  }

  /** Returns the media keys, or null if they were not created yet. */
  @Nullable
  public MediaKeys getMediaKeys() {
    return mediaKeys;
  }

  /** Returns the key session, or null if none was created yet. */
  @Nullable
  public MediaKeySession getSession() {
    return session;
  }

  /** Returns the key id extracted from the init data, or null if none is known. */
  @Nullable
  public String getKeyId() {
    return keyId;
  }

  /** Returns whether a license request was already generated for the session. */
  public boolean isSessionInitialized() {
    return sessionInitialized;
  }

  /* package */ void setMediaKeys(MediaKeys mediaKeys) {
    checkState(this.mediaKeys == null);
    this.mediaKeys = mediaKeys;
  }

  /* package */ void setSession(MediaKeySession session) {
    checkState(this.session == null);
    this.session = session;
    state = State.SESSION_CREATED;
  }

  /* package */ void setKeyId(@Nullable String keyId) {
    checkState(this.keyId == null);
    this.keyId = keyId;
  }

  /* package */ void markSessionInitialized() {
    checkState(!sessionInitialized);
    sessionInitialized = true;
  }

  /* package */ void onRequestGenerated() {
    state = State.REQUEST_GENERATED;
  }

  /* package */ void onRequestFailed() {
    state = State.REQUEST_FAILED;
  }
}
