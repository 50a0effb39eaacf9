package org.kidoni.calc.cli;

import java.util.ArrayList;
import java.util.List;

import org.kidoni.calc.Environment;
import org.kidoni.calc.EnvironmentBuilder;
import org.kidoni.calc.TrigModeAdapter;

/**
 * State the calculator keeps between inputs. Values only change after an evaluation succeeded.
 */
public class Session {
    private final CalculatorConfig config;
    private final List<HistoryEntry> history = new ArrayList<>();
    private TrigModeAdapter trig;
    private double ans;
    private double mem;
    private int precision;

    public Session(final CalculatorConfig config) {
        assert config != null;
        this.config = config;
        reset();
    }

    public final void reset() {
        trig = new TrigModeAdapter(config.mode());
        precision = config.precision();
        ans = 0.0;
        mem = 0.0;
        history.clear();
    }

    public Environment environment() {
        return EnvironmentBuilder.build(trig.getMode(), ans, mem);
    }

    public void recordResult(String expression, double result) {
        ans = result;
        history.add(new HistoryEntry(expression, result));
    }

    /**
     * @return up to the configured number of most recent entries, oldest first
     */
    public List<HistoryEntry> recentHistory() {
        int from = Math.max(0, history.size() - config.historySize());
        return List.copyOf(history.subList(from, history.size()));
    }

    public TrigModeAdapter trig() {
        return trig;
    }

    public double ans() {
        return ans;
    }

    public double mem() {
        return mem;
    }

    public void setMem(double mem) {
        this.mem = mem;
    }

    public int precision() {
        return precision;
    }

    public void setPrecision(int precision) {
        this.precision = CalculatorConfig.clampPrecision(precision);
    }
}
