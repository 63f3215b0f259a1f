package io.github.yok.ssmmigrator.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.ssmmigrator.config.Environment;
import java.util.Iterator;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable, ordered list of {@link NamePair}s for one environment. Iteration follows the order of
 * the configured variables.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public class NameMapping implements Iterable<NamePair> {

    private final Environment environment;
    private final ImmutableList<NamePair> pairs;

    /**
     * Constructs a mapping.
     *
     * @param environment environment the names were built for
     * @param pairs pairs in migration order
     */
    public NameMapping(Environment environment, List<NamePair> pairs) {
        this.environment = Preconditions.checkNotNull(environment, "environment must not be null");
        this.pairs = ImmutableList.copyOf(pairs);
    }

    public int size() {
        return pairs.size();
    }

    @Override
    public Iterator<NamePair> iterator() {
        return pairs.iterator();
    }
}
