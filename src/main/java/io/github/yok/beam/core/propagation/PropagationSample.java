package io.github.yok.beam.core.propagation;

import lombok.Value;

/**
 * 光軸上の位置 z と、その位置で計測した直径 d の組です。
 */
@Value
public class PropagationSample {

    /**
     * 光軸上の位置です。
     */
    double z;

    /**
     * 直径（D4σ）です。
     */
    double diameter;
}
