package com.example.monitoring.dsp;

import com.example.monitoring.model.ConditionedSignals;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Band-limits the raw waveforms and removes baseline wander. Deterministic, one output sample
 * per input sample, no error path.
 */
@ApplicationScoped
public class SignalConditioner {

    private final double ecgSampleRate;
    private final double ppgSampleRate;
    private final Biquad ecgLowPass;
    private final Biquad ppgLowPass;
    private final Biquad ecgBaseline;
    private final Biquad ppgBaseline;

    @Inject
    public SignalConditioner(
        @ConfigProperty(name = "monitoring.dsp.ecg-sample-rate", defaultValue = "250") double ecgSampleRate,
        @ConfigProperty(name = "monitoring.dsp.ppg-sample-rate", defaultValue = "100") double ppgSampleRate,
        @ConfigProperty(name = "monitoring.dsp.ecg-low-pass-hz", defaultValue = "40") double ecgCutoff,
        @ConfigProperty(name = "monitoring.dsp.ppg-low-pass-hz", defaultValue = "10") double ppgCutoff,
        @ConfigProperty(name = "monitoring.dsp.baseline-high-pass-hz", defaultValue = "0.5") double baselineCutoff
    ) {
        this.ecgSampleRate = ecgSampleRate;
        this.ppgSampleRate = ppgSampleRate;
        this.ecgLowPass = Biquad.lowPass(ecgCutoff, ecgSampleRate);
        this.ppgLowPass = Biquad.lowPass(ppgCutoff, ppgSampleRate);
        this.ecgBaseline = Biquad.highPass(baselineCutoff, ecgSampleRate);
        this.ppgBaseline = Biquad.highPass(baselineCutoff, ppgSampleRate);
    }

    public static SignalConditioner withDefaults() {
        return new SignalConditioner(250, 100, 40, 10, 0.5);
    }

    public ConditionedSignals condition(float[] ecg, float[] ppg) {
        float[] ecgOut = ecg == null ? new float[0] : ecg.clone();
        float[] ppgOut = ppg == null ? new float[0] : ppg.clone();

        ecgLowPass.filtfilt(ecgOut);
        ecgBaseline.filtfilt(ecgOut);
        ppgLowPass.filtfilt(ppgOut);
        ppgBaseline.filtfilt(ppgOut);

        return new ConditionedSignals(ecgOut, ecgSampleRate, ppgOut, ppgSampleRate);
    }

    public double ecgSampleRate() {
        return ecgSampleRate;
    }

    public double ppgSampleRate() {
        return ppgSampleRate;
    }
}
