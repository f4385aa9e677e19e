package in.spreadarb.domain.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named, versioned rule bundle. Read-only while the engine runs;
 * replaced as a whole through an explicit reload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradingStrategy(
    @JsonProperty("id")
    String id,

    @JsonProperty("name")
    String name,

    @JsonProperty("version")
    int version,

    @JsonProperty("entry")
    EntryRules entry,

    @JsonProperty("exit")
    ExitRules exit,

    @JsonProperty("risk")
    RiskRules risk,

    @JsonProperty("advanced")
    AdvancedRules advanced
) {
    public TradingStrategy {
        if (entry == null) entry = EntryRules.defaults();
        if (exit == null) exit = ExitRules.defaults();
        if (risk == null) risk = RiskRules.defaults();
        if (advanced == null) advanced = AdvancedRules.defaults();
    }

    public static TradingStrategy defaults() {
        return new TradingStrategy("default", "Default", 1,
            EntryRules.defaults(), ExitRules.defaults(), RiskRules.defaults(), AdvancedRules.defaults());
    }

    public boolean isValid() {
        return id != null && !id.isBlank()
            && version > 0
            && entry.isValid() && exit.isValid() && risk.isValid() && advanced.isValid();
    }

    public TradingStrategy withEntry(EntryRules rules) {
        return new TradingStrategy(id, name, version, rules, exit, risk, advanced);
    }

    public TradingStrategy withExit(ExitRules rules) {
        return new TradingStrategy(id, name, version, entry, rules, risk, advanced);
    }

    public TradingStrategy withRisk(RiskRules rules) {
        return new TradingStrategy(id, name, version, entry, exit, rules, advanced);
    }

    public TradingStrategy withAdvanced(AdvancedRules rules) {
        return new TradingStrategy(id, name, version, entry, exit, risk, rules);
    }
}
