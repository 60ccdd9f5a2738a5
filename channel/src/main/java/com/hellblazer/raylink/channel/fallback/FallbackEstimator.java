/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Raylink.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.raylink.channel.fallback;

import com.hellblazer.raylink.channel.config.RadioConfiguration;
import com.hellblazer.raylink.channel.mobility.MobilityModel;

import java.time.Duration;

/**
 * Oracle-free estimate of a link, used to decide whether raytracing it is worth the round trip.
 * <p>
 * A link whose free space received power plus margin is below the noise floor cannot matter to the receiver, so the
 * closed-form loss and delay are authoritative for it.
 *
 * @author hal.hildebrand
 */
public class FallbackEstimator {

    private final FreeSpacePropagationLossModel      lossModel;
    private final ConstantSpeedPropagationDelayModel delayModel;
    private final double                             noiseFloorDbm;
    private final double                             marginDb;

    /**
     * @param radio    radio parameters; the centre frequency drives the loss model, the bandwidth the noise floor
     * @param marginDb margin added to the received power before the comparison
     */
    public FallbackEstimator(RadioConfiguration radio, double marginDb) {
        this(new FreeSpacePropagationLossModel(radio.centerFrequencyHz()), new ConstantSpeedPropagationDelayModel(),
             radio.noiseFloorDbm(), marginDb);
    }

    public FallbackEstimator(FreeSpacePropagationLossModel lossModel, ConstantSpeedPropagationDelayModel delayModel,
                             double noiseFloorDbm, double marginDb) {
        this.lossModel = lossModel;
        this.delayModel = delayModel;
        this.noiseFloorDbm = noiseFloorDbm;
        this.marginDb = marginDb;
    }

    /**
     * @param txPowerDbm transmit power (dBm)
     * @param a          transmitter
     * @param b          receiver
     * @return true if {@code rxPower + margin < noiseFloor}
     */
    public boolean isBelowNoiseFloor(double txPowerDbm, MobilityModel a, MobilityModel b) {
        return rxPower(txPowerDbm, a, b) + marginDb < noiseFloorDbm;
    }

    public double rxPower(double txPowerDbm, MobilityModel a, MobilityModel b) {
        return lossModel.calcRxPower(txPowerDbm, a, b);
    }

    /**
     * @return free space pathloss (dB)
     */
    public double loss(MobilityModel a, MobilityModel b) {
        return lossModel.loss(a.distanceFrom(b));
    }

    public Duration delay(MobilityModel a, MobilityModel b) {
        return delayModel.getDelay(a, b);
    }

    public double noiseFloorDbm() {
        return noiseFloorDbm;
    }

    public double marginDb() {
        return marginDb;
    }
}
