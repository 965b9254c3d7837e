package com.framelint.core.rule;

import com.framelint.core.config.LintConfig.RulesConfig;
import com.framelint.core.rule.impl.component.ComponentNotUsedRule;
import com.framelint.core.rule.impl.layout.AbsolutePositioningRule;
import com.framelint.core.rule.impl.layout.AutoLayoutRequiredRule;
import com.framelint.core.rule.impl.layout.DepthTooDeepRule;
import com.framelint.core.rule.impl.layout.LayerAbuseRule;
import com.framelint.core.rule.impl.responsive.MinWidthMissingRule;
import com.framelint.core.rule.impl.responsive.WrapOffRule;
import com.framelint.core.rule.impl.semantic.NonSemanticNameRule;
import com.framelint.core.rule.impl.size.FixedSizeDetectedRule;
import com.framelint.core.rule.impl.size.HugFillViolationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Ordered, immutable set of rules.
 *
 * <p>Rules are kept sorted by {@link Rule#getOrder()} (ties broken by id) and ids are
 * unique. A catalogue is safe to share between threads and analyses.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RuleCatalogue catalogue = RuleCatalogue.discover().filter(config.rules());
 * RuleEngine engine = new RuleEngine(catalogue);
 * }</pre>
 */
public final class RuleCatalogue {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalogue.class);

    private static final Comparator<Rule> RULE_ORDER =
        Comparator.comparingInt(Rule::getOrder).thenComparing(Rule::getId);

    private final List<Rule> rules;

    /**
     * Creates a catalogue from the given rules.
     *
     * @param rules rules in any order
     * @throws IllegalArgumentException if two rules share an id
     */
    public RuleCatalogue(Collection<? extends Rule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        Set<String> ids = new HashSet<>();
        for (Rule rule : rules) {
            if (!ids.add(rule.getId())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.getId());
            }
        }
        List<Rule> sorted = new ArrayList<>(rules);
        sorted.sort(RULE_ORDER);
        this.rules = List.copyOf(sorted);
    }

    /**
     * The ten built-in rules, constructed directly.
     *
     * @return baseline catalogue
     */
    public static RuleCatalogue baseline() {
        return new RuleCatalogue(List.of(
            new AutoLayoutRequiredRule(),
            new AbsolutePositioningRule(),
            new FixedSizeDetectedRule(),
            new WrapOffRule(),
            new NonSemanticNameRule(),
            new DepthTooDeepRule(),
            new HugFillViolationRule(),
            new MinWidthMissingRule(),
            new ComponentNotUsedRule(),
            new LayerAbuseRule()
        ));
    }

    /**
     * Loads every rule registered under {@code META-INF/services/com.framelint.core.rule.Rule}.
     *
     * @return discovered catalogue
     */
    public static RuleCatalogue discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Loads every registered rule visible to a class loader.
     *
     * @param classLoader loader to search
     * @return discovered catalogue
     */
    public static RuleCatalogue discover(ClassLoader classLoader) {
        List<Rule> discovered = new ArrayList<>();
        ServiceLoader.load(Rule.class, classLoader).forEach(discovered::add);
        log.debug("Discovered {} rules via ServiceLoader", discovered.size());
        return new RuleCatalogue(discovered);
    }

    /**
     * Narrows this catalogue to the rules a configuration enables.
     *
     * @param config rule selection
     * @return filtered catalogue, order preserved
     */
    public RuleCatalogue filter(RulesConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        List<Rule> enabled = rules.stream()
            .filter(rule -> config.isEnabled(rule.getId()))
            .toList();
        for (String id : config.referencedIds()) {
            if (find(id).isEmpty()) {
                log.warn("Configuration names unknown rule: {}", id);
            }
        }
        if (enabled.size() < rules.size()) {
            log.info("Running {} of {} rules", enabled.size(), rules.size());
        }
        return new RuleCatalogue(enabled);
    }

    public List<Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Definitions of all rules in catalogue order.
     *
     * @return rule definitions
     */
    public List<RuleDefinition> definitions() {
        return rules.stream()
            .map(Rule::getDefinition)
            .toList();
    }

    /**
     * Looks up a rule by id.
     *
     * @param ruleId rule id
     * @return the rule, or empty if not in this catalogue
     */
    public Optional<Rule> find(String ruleId) {
        return rules.stream()
            .filter(rule -> rule.getId().equals(ruleId))
            .findFirst();
    }
}
