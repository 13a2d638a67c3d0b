package io.intellixity.restquery.examples.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/** Pools and clients opened for the configured backends; closed in reverse order on shutdown. */
public final class BackendResources implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BackendResources.class);

  private final Deque<AutoCloseable> open = new ArrayDeque<>();

  public synchronized <T extends AutoCloseable> T track(T resource) {
    open.push(resource);
    return resource;
  }

  @Override
  public synchronized void close() {
    while (!open.isEmpty()) {
      AutoCloseable r = open.pop();
      try {
        r.close();
      } catch (Exception e) {
        log.warn("restquery.examples op=close resource={} failed={}", r.getClass().getSimpleName(), e.toString());
      }
    }
  }
}
