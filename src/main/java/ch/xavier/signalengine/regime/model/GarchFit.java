package ch.xavier.signalengine.regime.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class GarchFit {
    private final GarchParameters parameters;
    private final double logLikelihood;
    private final double[] variances;
}
