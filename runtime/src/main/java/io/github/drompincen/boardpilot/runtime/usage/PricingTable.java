package io.github.drompincen.boardpilot.runtime.usage;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Provider cost per model and the billed price derived from it:
 * {@code price = ceil(cost * markup / increment) * increment}.
 */
@Component
public class PricingTable {

    /** USD per one million tokens. */
    public record Rate(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
        static Rate of(String input, String output) {
            return new Rate(new BigDecimal(input), new BigDecimal(output));
        }
    }

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    private static final Map<String, Rate> MODEL_RATES = Map.ofEntries(
            Map.entry("gpt-4o", Rate.of("2.50", "10.00")),
            Map.entry("gpt-4o-mini", Rate.of("0.15", "0.60")),
            Map.entry("gpt-4-turbo", Rate.of("10.00", "30.00")),
            Map.entry("gpt-4", Rate.of("30.00", "60.00")),
            Map.entry("gpt-3.5-turbo", Rate.of("0.50", "1.50")),
            Map.entry("o3-mini", Rate.of("1.10", "4.40")),
            Map.entry("claude-opus-4-20250514", Rate.of("15.00", "75.00")),
            Map.entry("claude-sonnet-4-20250514", Rate.of("3.00", "15.00")),
            Map.entry("claude-3-7-sonnet-20250219", Rate.of("3.00", "15.00")),
            Map.entry("claude-3-5-sonnet-20241022", Rate.of("3.00", "15.00")),
            Map.entry("claude-3-5-haiku-20241022", Rate.of("0.80", "4.00")),
            Map.entry("claude-3-opus-20240229", Rate.of("15.00", "75.00")),
            Map.entry("claude-3-haiku-20240307", Rate.of("0.25", "1.25"))
    );

    private static final Map<String, Rate> PROVIDER_RATES = Map.of(
            "anthropic", Rate.of("3.00", "15.00"),
            "openai", Rate.of("2.50", "10.00")
    );

    private static final Rate UNKNOWN = Rate.of("3.00", "15.00");

    private final BigDecimal markup;
    private final BigDecimal increment;

    public PricingTable(@Value("${boardpilot.pricing.markup:5.0}") double markup,
                        @Value("${boardpilot.pricing.increment:0.01}") double increment) {
        if (markup <= 0 || increment <= 0) {
            throw new IllegalArgumentException("markup and increment must be positive");
        }
        this.markup = BigDecimal.valueOf(markup);
        this.increment = BigDecimal.valueOf(increment);
    }

    public Rate rateFor(String provider, String model) {
        if (model != null) {
            Rate rate = MODEL_RATES.get(model.toLowerCase());
            if (rate != null) {
                return rate;
            }
        }
        if (provider != null) {
            return PROVIDER_RATES.getOrDefault(provider.toLowerCase(), UNKNOWN);
        }
        return UNKNOWN;
    }

    public BigDecimal cost(String provider, String model, int inputTokens, int outputTokens) {
        Rate rate = rateFor(provider, model);
        BigDecimal in = rate.inputPerMillion().multiply(BigDecimal.valueOf(inputTokens));
        BigDecimal out = rate.outputPerMillion().multiply(BigDecimal.valueOf(outputTokens));
        return in.add(out).divide(MILLION, 8, RoundingMode.HALF_UP);
    }

    public BigDecimal price(BigDecimal cost) {
        if (cost == null || cost.signum() <= 0) {
            return BigDecimal.ZERO.setScale(increment.scale());
        }
        BigDecimal steps = cost.multiply(markup).divide(increment, 0, RoundingMode.CEILING);
        return steps.multiply(increment);
    }
}
