/*
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
package org.funnelscope.bigquery;

import com.google.auto.service.AutoService;
import com.google.inject.Binder;
import com.google.inject.Scopes;
import org.funnelscope.analysis.FunnelAnalysisService;
import org.funnelscope.analysis.FunnelPlanExecutor;
import org.funnelscope.config.FunnelConfig;
import org.funnelscope.plugin.ConditionalModule;
import org.funnelscope.plugin.FunnelModule;

/**
 * Funnel analysis on BigQuery. The application binds the {@link org.funnelscope.report.QueryExecutor} that talks to
 * BigQuery.
 */
@AutoService(FunnelModule.class)
@ConditionalModule(config = "funnel.backend", value = "bigquery")
public class BigQueryFunnelModule extends FunnelModule {

    @Override
    protected void setup(Binder binder) {
        buildConfigObject(BigQueryConfig.class);
        buildConfigObject(FunnelConfig.class);

        binder.bind(BigQueryFunnelQueryRenderer.class).in(Scopes.SINGLETON);
        binder.bind(FunnelPlanExecutor.class).to(BigQueryFunnelPlanExecutor.class).in(Scopes.SINGLETON);
        binder.bind(CustomQueryService.class).in(Scopes.SINGLETON);
        binder.bind(FunnelAnalysisService.class).in(Scopes.SINGLETON);
    }

    @Override
    public String name() {
        return "BigQuery Module";
    }

    @Override
    public String description() {
        return "Funnel and A/B analysis on BigQuery event tables";
    }
}
