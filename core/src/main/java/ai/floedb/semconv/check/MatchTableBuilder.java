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

package ai.floedb.semconv.check;

import ai.floedb.semconv.catalog.AttributeSet;
import ai.floedb.semconv.catalog.SemconvCatalog;
import ai.floedb.semconv.catalog.UnknownGroupException;
import ai.floedb.semconv.config.CheckerSettings;
import ai.floedb.semconv.config.CheckerSettings.MetricRuleSettings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jboss.logging.Logger;

/**
 * Compiles checker settings against a semantic convention catalog. Runs once at startup; any
 * invalid pattern or unknown group aborts the build with a {@link CheckerConfigException}.
 */
public final class MatchTableBuilder {
  private static final Logger LOG = Logger.getLogger(MatchTableBuilder.class);

  private MatchTableBuilder() {}

  public static CompiledRules build(CheckerSettings settings, SemconvCatalog catalog) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(catalog, "catalog");

    var resourceSettings = settings.resource();
    AttributeSet resourceRequired = resolve(catalog, resourceSettings.groups(), "resource");
    var resource =
        new ResourceSchema(
            resourceRequired, new LinkedHashSet<>(resourceSettings.ignore()), catalog.schemaUrl());

    List<MatchRule> rules = new ArrayList<>(settings.metrics().size());
    int index = 0;
    for (MetricRuleSettings rule : settings.metrics()) {
      rules.add(compile(index++, rule, catalog));
    }

    LOG.infof(
        "Compiled checker rules metricRules=%d resourceAttributes=%d expectedVersion=%s",
        rules.size(), resourceRequired.size(), catalog.schemaUrl());
    return new CompiledRules(new MatchTable(rules), resource, settings.reportUnmatched());
  }

  private static MatchRule compile(int index, MetricRuleSettings rule, SemconvCatalog catalog) {
    String where = "metrics[" + index + "]";
    if (rule == null || rule.match() == null) {
      throw new CheckerConfigException(where + ".match is required");
    }
    Pattern pattern;
    try {
      pattern = Pattern.compile(rule.match());
    } catch (PatternSyntaxException e) {
      throw new CheckerConfigException(
          where + ".match is not a valid pattern: " + rule.match(), e);
    }
    AttributeSet required = resolve(catalog, rule.groups(), where);
    return new MatchRule(index, pattern, required, new LinkedHashSet<>(rule.ignore()));
  }

  private static AttributeSet resolve(SemconvCatalog catalog, List<String> groups, String where) {
    try {
      return catalog.attributes(groups);
    } catch (UnknownGroupException e) {
      throw new CheckerConfigException(
          where + ".groups references unknown group " + e.groupId(), e);
    }
  }
}
