package io.intellixity.restquery.rbac;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Reads an {@link RbacConfig} from JSON. */
public final class RbacConfigLoader {
  private final ObjectMapper mapper;

  public RbacConfigLoader() {
    this(new ObjectMapper());
  }

  public RbacConfigLoader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public RbacConfig load(InputStream in) {
    Objects.requireNonNull(in, "in");
    try {
      return mapper.readValue(in, RbacConfig.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read RBAC configuration", e);
    }
  }

  public RbacConfig load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read RBAC configuration from " + file, e);
    }
  }
}
