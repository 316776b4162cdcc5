/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.postgres.reporter.check.settings;

import ai.postgres.reporter.check.Check;
import ai.postgres.reporter.check.CheckContext;
import ai.postgres.reporter.check.SettingsFilter;
import ai.postgres.reporter.model.MetricSample;
import ai.postgres.reporter.prometheus.MetricQueries;
import ai.postgres.reporter.report.CheckType;
import ai.postgres.reporter.settings.SettingsCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistics-extension settings taken from A003, plus live probes telling whether
 * pg_stat_statements and pg_stat_kcache data actually reaches the backend.
 */
@ApplicationScoped
public class D004PgStatSettingsCheck implements Check {

    static final String METRIC_PGSS_CALLS = "pgwatch_pg_stat_statements_calls";
    static final String METRIC_KCACHE_USER_TIME = "pgwatch_pg_stat_kcache_exec_user_time";
    static final String METRIC_KCACHE_SYSTEM_TIME = "pgwatch_pg_stat_kcache_exec_system_time";
    static final String METRIC_KCACHE_TOTAL_TIME = "pgwatch_pg_stat_kcache_exec_total_time";
    static final int SAMPLE_SIZE = 5;

    private final MetricQueries queries;

    @Inject
    public D004PgStatSettingsCheck(MetricQueries queries) {
        this.queries = queries;
    }

    @Override
    public CheckType type() {
        return CheckType.D004;
    }

    @Override
    public D004Data collect(CheckContext context) {
        return new D004Data(
                SettingsFilter.filterA003Settings(context.settings(), SettingsCatalog.D004_SETTINGS),
                pgStatStatementsStatus(context),
                pgStatKcacheStatus(context));
    }

    PgStatStatementsStatus pgStatStatementsStatus(CheckContext context) {
        List<MetricSample> samples = queries.instant(context.selector(METRIC_PGSS_CALLS).build());
        if (samples.isEmpty()) {
            return PgStatStatementsStatus.UNAVAILABLE;
        }
        double totalCalls = 0;
        List<PgStatStatementsStatus.Sample> sampled = new ArrayList<>();
        for (MetricSample sample : samples.subList(0, Math.min(SAMPLE_SIZE, samples.size()))) {
            double calls = finite(sample.value());
            totalCalls += calls;
            sampled.add(new PgStatStatementsStatus.Sample(
                    sample.label("queryid", "unknown"),
                    user(sample),
                    sample.label("datname", "unknown"),
                    calls));
        }
        return new PgStatStatementsStatus(true, samples.size(), totalCalls, sampled);
    }

    PgStatKcacheStatus pgStatKcacheStatus(CheckContext context) {
        List<MetricSample> userTime = queries.instant(context.selector(METRIC_KCACHE_USER_TIME).build());
        List<MetricSample> systemTime = queries.instant(context.selector(METRIC_KCACHE_SYSTEM_TIME).build());
        List<MetricSample> totalTime = queries.instant(context.selector(METRIC_KCACHE_TOTAL_TIME).build());

        boolean available = !userTime.isEmpty() || !systemTime.isEmpty() || !totalTime.isEmpty();
        List<PgStatKcacheStatus.Sample> sampled = new ArrayList<>();
        for (MetricSample sample : head(totalTime)) {
            sampled.add(new PgStatKcacheStatus.Sample(
                    sample.label("queryid", "unknown"), user(sample), finite(sample.value())));
        }
        return new PgStatKcacheStatus(
                available,
                totalTime.size(),
                sum(head(totalTime)),
                sum(head(userTime)),
                sum(head(systemTime)),
                sampled);
    }

    private static List<MetricSample> head(List<MetricSample> samples) {
        return samples.subList(0, Math.min(SAMPLE_SIZE, samples.size()));
    }

    private static double sum(List<MetricSample> samples) {
        return samples.stream().mapToDouble(s -> finite(s.value())).sum();
    }

    private static String user(MetricSample sample) {
        return sample.label("tag_user", sample.label("user", "unknown"));
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
