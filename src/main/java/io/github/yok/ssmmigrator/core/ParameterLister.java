package io.github.yok.ssmmigrator.core;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.github.yok.ssmmigrator.store.ParameterStore;
import io.github.yok.ssmmigrator.store.ParameterSummary;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the parameters of the store, optionally narrowed to a name prefix. Used by the
 * {@code --list} mode to inspect a hierarchy before or after a migration.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ParameterLister {

    private final ParameterStore parameterStore;

    public ParameterLister(ParameterStore parameterStore) {
        this.parameterStore =
                Preconditions.checkNotNull(parameterStore, "parameterStore must not be null");
    }

    /**
     * Lists parameters whose name starts with {@code prefix}.
     *
     * @param prefix name prefix; {@code null} or empty lists everything
     * @return the listed summaries in store order
     */
    public List<ParameterSummary> execute(String prefix) {
        String filter = Strings.nullToEmpty(prefix);
        List<ParameterSummary> matched = parameterStore.listAll().stream()
                .filter(summary -> summary.getName().startsWith(filter))
                .collect(Collectors.toList());
        for (ParameterSummary summary : matched) {
            log.info("name: {}, type: {}, description: {}", summary.getName(),
                    summary.getType().getWireName(), Strings.nullToEmpty(summary.getDescription()));
        }
        log.info("{} parameter(s) under [{}]", matched.size(), filter.isEmpty() ? "/" : filter);
        return matched;
    }
}
