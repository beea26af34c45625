package ballisticmc.physics.impl;

import ballisticmc.config.SimulationConfig;
import ballisticmc.domain.band.FermiSurface;
import ballisticmc.domain.geometry.AuxiliaryLines;
import ballisticmc.domain.geometry.DeviceFrame;
import ballisticmc.domain.simulation.SimulationResult;
import ballisticmc.physics.simulator.MonteCarloSimulator;
import lombok.Getter;

import java.util.concurrent.Callable;

/**
 * Tarea que ejecuta una simulación completa para un único valor de campo.
 * Cada tarea construye su propio simulador (y su propio generador), así que
 * varias pueden ejecutarse en paralelo sin compartir estado mutable.
 */
public class FieldSimulationTask implements Callable<SimulationResult> {

    private final FermiSurface surface;
    private final DeviceFrame device;
    private final AuxiliaryLines lines;
    @Getter
    private final SimulationConfig config;

    public FieldSimulationTask(FermiSurface surface, DeviceFrame device, AuxiliaryLines lines, SimulationConfig config) {
        this.surface = surface;
        this.device = device;
        this.lines = lines;
        this.config = config;
    }

    @Override
    public SimulationResult call() {
        return new MonteCarloSimulator(surface, device, lines, config).runSimulation();
    }
}
