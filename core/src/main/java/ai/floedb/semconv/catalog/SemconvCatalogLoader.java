/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.semconv.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/**
 * Loads semantic convention group files ({@code groups:} YAML as published by the semantic
 * conventions repository) into an immutable {@link SemconvCatalog}.
 *
 * <p>The location is either {@code classpath:<resource>} for a bundled file, a single YAML file,
 * or a directory whose {@code *.yaml}/{@code *.yml} files are read in name order. All files that
 * declare {@code schema_url} must agree on it.
 */
public final class SemconvCatalogLoader {
  public static final String DEFAULT_LOCATION = "classpath:semconv/registry.yaml";

  private static final Logger LOG = Logger.getLogger(SemconvCatalogLoader.class);

  private final ObjectMapper mapper;

  public SemconvCatalogLoader() {
    this.mapper =
        new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
  }

  public SemconvCatalog load(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();

    List<CatalogFile> files = new ArrayList<>();
    if (loc.startsWith("classpath:")) {
      files.add(readClasspath(loc.substring("classpath:".length())));
    } else {
      String basePath = loc.startsWith("file:") ? loc.substring(5) : loc;
      Path path = Paths.get(basePath);
      if (Files.isDirectory(path)) {
        for (Path file : listYaml(path)) {
          files.add(readFile(file));
        }
      } else if (Files.exists(path)) {
        files.add(readFile(path));
      } else {
        throw new SemconvCatalogLoadException("Semantic convention catalog not found: " + loc);
      }
    }

    SemconvCatalog catalog = toCatalog(loc, files);
    LOG.infof(
        "Loaded semantic convention catalog location=%s groups=%d schemaUrl=%s",
        loc, catalog.size(), catalog.schemaUrl());
    return catalog;
  }

  /** Parses a single catalog document, mainly for tests and embedded catalogs. */
  public SemconvCatalog load(InputStream in, String label) {
    Objects.requireNonNull(in, "in");
    try {
      return toCatalog(label, List.of(parse(in, label)));
    } catch (IOException e) {
      throw new SemconvCatalogLoadException("Failed to read semantic conventions " + label, e);
    }
  }

  private CatalogFile readClasspath(String resource) {
    String name = resource.startsWith("/") ? resource.substring(1) : resource;
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) {
      cl = SemconvCatalogLoader.class.getClassLoader();
    }
    try (InputStream in = cl.getResourceAsStream(name)) {
      if (in == null) {
        throw new SemconvCatalogLoadException(
            "Semantic convention catalog not found: classpath:" + name);
      }
      return parse(in, "classpath:" + name);
    } catch (IOException e) {
      throw new SemconvCatalogLoadException("Failed to read semantic conventions " + name, e);
    }
  }

  private CatalogFile readFile(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return parse(in, file.toString());
    } catch (IOException e) {
      throw new SemconvCatalogLoadException("Failed to read semantic conventions " + file, e);
    }
  }

  private static List<Path> listYaml(Path dir) {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(
              p -> {
                String name = p.getFileName().toString();
                return name.endsWith(".yaml") || name.endsWith(".yml");
              })
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new SemconvCatalogLoadException("Failed to list semantic conventions in " + dir, e);
    }
  }

  private CatalogFile parse(InputStream in, String label) throws IOException {
    CatalogFile file = mapper.readValue(in, CatalogFile.class);
    if (file == null) {
      file = new CatalogFile();
    }
    file.label = label;
    return file;
  }

  private static SemconvCatalog toCatalog(String location, List<CatalogFile> files) {
    String schemaUrl = null;
    List<SemconvGroup> groups = new ArrayList<>();
    for (CatalogFile file : files) {
      if (file.schemaUrl != null && !file.schemaUrl.isBlank()) {
        if (schemaUrl != null && !schemaUrl.equals(file.schemaUrl)) {
          throw new SemconvCatalogLoadException(
              "Conflicting schema_url in "
                  + file.label
                  + ": "
                  + file.schemaUrl
                  + " (expected "
                  + schemaUrl
                  + ")");
        }
        schemaUrl = file.schemaUrl;
      }
      if (file.groups == null) {
        continue;
      }
      for (GroupEntry entry : file.groups) {
        groups.add(toGroup(file.label, entry));
      }
    }
    if (schemaUrl == null) {
      throw new SemconvCatalogLoadException("No schema_url declared in " + location);
    }
    return new SemconvCatalog(schemaUrl, groups);
  }

  private static SemconvGroup toGroup(String label, GroupEntry entry) {
    if (entry.id == null || entry.id.isBlank()) {
      throw new SemconvCatalogLoadException("Group without id in " + label);
    }
    List<String> names = new ArrayList<>();
    if (entry.attributes != null) {
      for (AttributeEntry attr : entry.attributes) {
        names.add(attributeName(label, entry, attr));
      }
    }
    return new SemconvGroup(entry.id, entry.prefix, entry.extendsId, names);
  }

  private static String attributeName(String label, GroupEntry group, AttributeEntry attr) {
    if (attr.ref != null && !attr.ref.isBlank()) {
      return attr.ref;
    }
    if (attr.id == null || attr.id.isBlank()) {
      throw new SemconvCatalogLoadException(
          "Attribute without id or ref in group " + group.id + " (" + label + ")");
    }
    if (group.prefix != null && !group.prefix.isBlank()) {
      return group.prefix + "." + attr.id;
    }
    return attr.id;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class CatalogFile {
    @JsonProperty("schema_url")
    String schemaUrl;

    @JsonProperty("groups")
    List<GroupEntry> groups;

    String label;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class GroupEntry {
    @JsonProperty("id")
    String id;

    @JsonProperty("prefix")
    String prefix;

    @JsonProperty("extends")
    String extendsId;

    @JsonProperty("attributes")
    List<AttributeEntry> attributes;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class AttributeEntry {
    @JsonProperty("id")
    String id;

    @JsonProperty("ref")
    String ref;
  }
}
