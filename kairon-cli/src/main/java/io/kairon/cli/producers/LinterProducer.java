package io.kairon.cli.producers;

import io.kairon.core.LinterConfig;
import io.kairon.core.WorkflowLinter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the {@link WorkflowLinter} used by all commands.
///
/// Builds the {@link LinterConfig} from `kairon.lint.*` properties; absent properties
/// keep the built-in defaults.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `kairon.lint.pre-context-prefixes` | List | `Parse,Prepare,Determine,Check` | Code node name prefixes exempt from the ctx convention |
/// | `kairon.lint.approved-namespaces` | List | `event,llm,db,...` | ctx namespaces accepted silently |
/// | `kairon.lint.tolerated-namespaces` | List | `response,error,result,data` | ctx namespaces accepted without a warning |
/// | `kairon.lint.database-workflow` | String | `Query_DB` | Workflow allowed to use Postgres directly |
/// | `kairon.lint.disabled-rules` | List | - | Rule ids to skip |
///
/// @implNote The linter is produced as a `@Singleton` pseudo-scope bean. It is immutable
/// and shared by the validation worker threads.
@ApplicationScoped
public class LinterProducer {

    private static final Logger logger = Logger.getLogger(LinterProducer.class.getName());

    @Inject Config config;

    @Produces
    @Singleton
    public WorkflowLinter workflowLinter() {
        LinterConfig linterConfig = linterConfig();
        if (!linterConfig.getDisabledRules().isEmpty()) {
            logger.info("Disabled lint rules: " + String.join(", ", linterConfig.getDisabledRules()));
        }
        return new WorkflowLinter(linterConfig);
    }

    /// Reads the linter configuration from MicroProfile Config.
    ///
    /// @return configuration, never null
    LinterConfig linterConfig() {
        LinterConfig.Builder builder = LinterConfig.builder();
        values("kairon.lint.pre-context-prefixes").ifPresent(builder::preContextPrefixes);
        values("kairon.lint.approved-namespaces").ifPresent(builder::approvedNamespaces);
        values("kairon.lint.tolerated-namespaces").ifPresent(builder::toleratedNamespaces);
        config.getOptionalValue("kairon.lint.database-workflow", String.class)
                .ifPresent(builder::databaseWorkflow);
        values("kairon.lint.disabled-rules")
                .ifPresent(ids -> builder.disableRules(new LinkedHashSet<>(ids)));
        return builder.build();
    }

    private Optional<List<String>> values(String property) {
        return config.getOptionalValues(property, String.class);
    }
}
