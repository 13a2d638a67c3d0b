package io.intellixity.restquery.rbac;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RbacCollectionConfig(@JsonProperty("collection_name") String collectionName,
                                   @JsonProperty("rbac_config") Rules rbacConfig) {
  public RbacCollectionConfig {
    Objects.requireNonNull(collectionName, "collectionName");
    rbacConfig = rbacConfig == null ? new Rules(null, null, null) : rbacConfig;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Rules(@JsonProperty("read") List<RbacRule> read,
                      @JsonProperty("write") List<RbacRule> write,
                      @JsonProperty("delete") List<RbacRule> delete) {
    public Rules {
      read = read == null ? List.of() : List.copyOf(read);
      write = write == null ? List.of() : List.copyOf(write);
      delete = delete == null ? List.of() : List.copyOf(delete);
    }

    public List<RbacRule> forAction(RbacAction action) {
      return switch (action) {
        case READ -> read;
        case WRITE -> write;
        case DELETE -> delete;
      };
    }
  }
}
