package gasthermo.physics.model;

import gasthermo.config.SolverConfig;
import gasthermo.domain.exception.ConvergenceException;
import gasthermo.domain.exception.InvalidPropertyAssignmentException;
import gasthermo.domain.exception.UnknownSpeciesException;
import gasthermo.domain.species.SpeciesRegistry;
import gasthermo.io.SpeciesRegistryReader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static gasthermo.config.ThermoConstants.P_STD;
import static gasthermo.config.ThermoConstants.T_STD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para GasState.
 * Los valores de referencia se han obtenido con los coeficientes NASA Glenn incluidos
 * en el jar (aire como especie única, MW = 28.9651159 g/mol).
 */
class GasStateTest {

    private static SpeciesRegistry registry;

    private GasState air;

    @BeforeAll
    static void loadRegistry() {
        registry = SpeciesRegistryReader.loadDefault();
    }

    @BeforeEach
    void setUp() {
        air = new GasState(registry);
    }

    private static double[] combustionProducts() {
        double[] y = new double[registry.size()];
        y[registry.indexOf("N2")] = 0.7;
        y[registry.indexOf("CO2")] = 0.1;
        y[registry.indexOf("H2O")] = 0.2;
        return y;
    }

    // --------------------------------------------------------------------------
    // Estado por defecto
    // --------------------------------------------------------------------------

    @Nested
    @DisplayName("Aire a condiciones estándar")
    class DefaultAir {

        @Test
        @DisplayName("T = 298.15 K, P = 101325 Pa y composición 100% aire")
        void defaultState() {
            assertEquals(T_STD, air.getTemperature());
            assertEquals(P_STD, air.getPressure());
            assertEquals(1.0, air.getMassFractions()[registry.indexOf("Air")]);
            assertEquals(28.9651159, air.getMolecularWeight(), 1e-9);
        }

        @Test
        @DisplayName("cp ≈ 29.1 J/K/mol y s ≈ 0.199 kJ/K/mol")
        void referenceScenario() {
            assertEquals(29.1, air.getMolarSpecificHeat(), 0.1);
            assertEquals(0.199, air.getMolarEntropy() / 1000.0, 0.001);
        }

        @Test
        @DisplayName("Magnitudes específicas por kg")
        void specificProperties() {
            assertEquals(1004.7256, air.getSpecificHeat(), 1e-3);
            assertEquals(-4333.818, air.getEnthalpy(), 1e-2);
            assertEquals(6864.194, air.getEntropy(), 1e-2);
            assertEquals(287.0522, air.getGasConstant(), 1e-3);
            assertEquals(1.399976, air.getGamma(), 1e-5);
            assertEquals(1.183916, air.getDensity(), 1e-5);
            assertEquals(1.0 / air.getDensity(), air.getSpecificVolume(), 1e-15);
            assertEquals(-125.53, air.getFormationEnthalpy(), 1e-9);
        }

        @Test
        @DisplayName("En estado estándar con una sola especie, s = φ")
        void entropyEqualsComplementAtStandardPressure() {
            assertEquals(air.getEntropyComplement(), air.getEntropy(), 1e-9);
        }

        @Test
        @DisplayName("toString muestra los valores molares")
        void toStringShowsMolarValues() {
            assertThat(air.toString())
                    .startsWith("Ideal Gas at T = 298.150 K, P = 101.325 kPa, cp = 29.102 J/K/mol")
                    .contains("Air=1.0");
        }

        @Test
        @DisplayName("Un registro sin 'Air' no puede crear el gas por defecto")
        void registryWithoutAir() {
            SpeciesRegistry nitrogenOnly = SpeciesRegistry.of(List.of(registry.get(registry.indexOf("N2"))));
            assertThrows(UnknownSpeciesException.class, () -> new GasState(nitrogenOnly));
        }
    }

    // --------------------------------------------------------------------------
    // Temperatura y presión
    // --------------------------------------------------------------------------

    @Nested
    @DisplayName("Temperatura y presión")
    class TemperatureAndPressure {

        @Test
        @DisplayName("set_TP(596.3 K, 202650 Pa): cp ≈ 30.4 J/K/mol")
        void setTemperatureAndPressure_doubled() {
            // ACT
            air.setTemperatureAndPressure(596.3, 202650.0);

            // ASSERT
            assertEquals(30.4, air.getMolarSpecificHeat(), 0.1);
            assertEquals(30.4175, air.getMolarSpecificHeat(), 1e-3);
            assertEquals(8706.16, air.getMolarEnthalpy(), 1e-1);
            assertEquals(213.539, air.getMolarEntropy(), 1e-2);
            assertEquals(202650.0, air.getPressure());
        }

        @Test
        @DisplayName("Cambiar P solo afecta a la entropía")
        void setPressure_onlyChangesEntropy() {
            // ARRANGE
            double cp = air.getSpecificHeat();
            double h = air.getEnthalpy();
            double phi = air.getEntropyComplement();
            double s = air.getEntropy();

            // ACT
            air.setPressure(2 * P_STD);

            // ASSERT
            assertEquals(cp, air.getSpecificHeat());
            assertEquals(h, air.getEnthalpy());
            assertEquals(phi, air.getEntropyComplement());
            assertEquals(s - air.getGasConstant() * Math.log(2.0), air.getEntropy(), 1e-9);
        }

        @Test
        @DisplayName("cp del aire a 2000 K (juego de alta temperatura)")
        void setTemperature_highRange() {
            air.setTemperature(2000.0);
            assertEquals(1250.3156, air.getSpecificHeat(), 1e-3);
        }

        @Test
        @DisplayName("dφ/dT = cp/T coincide con la diferencia central de φ")
        void entropyComplementDerivative_matchesFiniteDifference() {
            air.setTemperature(650.0);
            double analytic = air.getEntropyComplementDerivative();

            air.setTemperature(650.5);
            double phiPlus = air.getEntropyComplement();
            air.setTemperature(649.5);
            double phiMinus = air.getEntropyComplement();

            assertEquals(phiPlus - phiMinus, analytic, 1e-6);
            assertEquals(air.getSpecificHeat(), air.getEnthalpyDerivative());
        }

        @Test
        @DisplayName("T o P no físicas se rechazan sin modificar el estado")
        void invalidTemperatureOrPressure() {
            GasSnapshot before = air.snapshot();

            InvalidPropertyAssignmentException ex = assertThrows(InvalidPropertyAssignmentException.class,
                    () -> air.setTemperature(-10.0));
            assertThat(ex.getMessage()).contains("gas.temperature").contains("debe ser finita y positiva");
            assertThrows(InvalidPropertyAssignmentException.class, () -> air.setTemperature(Double.NaN));
            assertThrows(InvalidPropertyAssignmentException.class, () -> air.setPressure(0.0));
            assertThrows(InvalidPropertyAssignmentException.class, () -> air.setTemperatureAndPressure(400.0, -1.0));

            assertEquals(before, air.snapshot());
        }
    }

    // --------------------------------------------------------------------------
    // Composición
    // --------------------------------------------------------------------------

    @Nested
    @DisplayName("Composición")
    class Composition {

        @Test
        @DisplayName("Productos de combustión: MW, cp, h, s y entalpía de formación")
        void combustionProductsProperties() {
            GasState gas = new GasState(registry, combustionProducts());

            assertEquals(26.067486, gas.getMolecularWeight(), 1e-6);
            assertEquals(1185.0197, gas.getSpecificHeat(), 1e-3);
            assertEquals(-3578820.117, gas.getEnthalpy(), 1e-2);
            assertEquals(7626.9528, gas.getEntropy(), 1e-3);
            assertEquals(-93290.956, gas.getFormationEnthalpy(), 1e-2);
            assertEquals(1.368290, gas.getGamma(), 1e-5);
        }

        @Test
        @DisplayName("Vector de fracciones másicas sin normalizar: se normaliza")
        void setMassFractions_vectorIsNormalized() {
            double[] y = new double[registry.size()];
            y[registry.indexOf("N2")] = 7.0;
            y[registry.indexOf("CO2")] = 1.0;
            y[registry.indexOf("H2O")] = 2.0;

            air.setMassFractions(y);

            assertArrayEquals(combustionProducts(), air.getMassFractions(), 1e-15);
            assertEquals(1185.0197, air.getSpecificHeat(), 1e-3);
        }

        @Test
        @DisplayName("Mapa de fracciones másicas sin normalizar: misma política que el vector")
        void setMassFractions_mapIsNormalized() {
            air.setMassFractions(Map.of("N2", 7.0, "CO2", 1.0, "H2O", 2.0));

            assertArrayEquals(combustionProducts(), air.getMassFractions(), 1e-15);
        }

        @Test
        @DisplayName("Fracciones molares por nombre: 79% N2 + 21% O2")
        void ofMoleFractions_nitrogenOxygen() {
            GasState gas = GasState.ofMoleFractions(registry, Map.of("N2", 79.0, "O2", 21.0));

            assertEquals(0.76708249, gas.getMassFractions()[registry.indexOf("N2")], 1e-8);
            assertEquals(28.850334, gas.getMolecularWeight(), 1e-6);
            assertEquals(1011.3455, gas.getSpecificHeat(), 1e-3);
            assertEquals(0.0, gas.getFormationEnthalpy(), 1e-12);
            assertThat(gas.getMoleFractionMap())
                    .containsOnlyKeys("N2", "O2")
                    .hasEntrySatisfying("O2", x -> assertEquals(0.21, x, 1e-12));
        }

        @Test
        @DisplayName("Cambiar la composición reevalúa las magnitudes a la T actual")
        void setComposition_reevaluatesAtCurrentTemperature() {
            air.setTemperature(1500.0);

            air.setMoleFractions(CompositionConverter.massToMole(combustionProducts(), registry));

            GasState reference = new GasState(registry, combustionProducts());
            reference.setTemperature(1500.0);
            assertEquals(1500.0, air.getTemperature());
            assertEquals(reference.getSpecificHeat(), air.getSpecificHeat(), 1e-9);
            assertEquals(reference.getEnthalpy(), air.getEnthalpy(), 1e-6);
        }

        @Test
        @DisplayName("Composición inválida: excepción y estado intacto")
        void invalidComposition_isAllOrNothing() {
            GasSnapshot before = air.snapshot();
            double[] negative = combustionProducts();
            negative[0] = -1.0;

            assertThrows(InvalidPropertyAssignmentException.class, () -> air.setMassFractions(negative));
            assertThrows(InvalidPropertyAssignmentException.class, () -> air.setMoleFractions(new double[3]));
            assertThrows(UnknownSpeciesException.class, () -> air.setMassFractions(Map.of("N2", 0.5, "Xe", 0.5)));

            assertEquals(before, air.snapshot());
            assertEquals(1.0, air.getMassFractions()[registry.indexOf("Air")]);
        }

        @Test
        @DisplayName("getMassFractions devuelve una copia defensiva")
        void getMassFractions_isACopy() {
            air.getMassFractions()[0] = 0.0;
            assertEquals(1.0, air.getMassFractions()[registry.indexOf("Air")]);
        }
    }

    // --------------------------------------------------------------------------
    // Setters por entalpía
    // --------------------------------------------------------------------------

    @Nested
    @DisplayName("Inversión de entalpía")
    class EnthalpyInversion {

        @Test
        @DisplayName("set_h(0) desde aire estándar → T ≈ 302.463 K")
        void setEnthalpy_zero() {
            air.setEnthalpy(0.0);

            assertEquals(302.463, air.getTemperature(), 1e-3);
            assertEquals(0.0, air.getEnthalpy(), 1e-8);
        }

        @Test
        @DisplayName("set_h(h actual) no mueve la temperatura")
        void setEnthalpy_isIdempotent() {
            air.setTemperature(812.0);

            air.setEnthalpy(air.getEnthalpy());

            assertEquals(812.0, air.getTemperature(), 1e-12);
        }

        @Test
        @DisplayName("Converge cruzando la frontera de 1000 K")
        void setEnthalpy_acrossSwitchBoundary() {
            GasState target = new GasState(registry);
            target.setTemperature(1500.0);

            air.setEnthalpy(target.getEnthalpy());

            assertEquals(1500.0, air.getTemperature(), 1e-9);
        }

        @Test
        @DisplayName("set_hP aplica la presión después de la entalpía")
        void setEnthalpyAndPressure() {
            air.setEnthalpyAndPressure(0.0, 5e5);

            assertEquals(302.463, air.getTemperature(), 1e-3);
            assertEquals(5e5, air.getPressure());
        }

        @Test
        @DisplayName("set_Δh con ηp = 1: aporte de trabajo isentrópico")
        void setEnthalpyChange_isentropic() {
            air.setEnthalpyChange(100000.0);

            assertEquals(397.3276, air.getTemperature(), 1e-3);
            assertEquals(277777.67, air.getPressure(), 1e-1);
        }

        @Test
        @DisplayName("set_Δh con ηp = 0.9: menos presión para el mismo trabajo")
        void setEnthalpyChange_polytropicCompression() {
            air.setEnthalpyChange(100000.0, 0.9);

            assertEquals(397.3276, air.getTemperature(), 1e-3);
            assertEquals(251130.38, air.getPressure(), 1e-1);
        }

        @Test
        @DisplayName("set_Δh negativo con ηp = 0.9: extracción de trabajo")
        void setEnthalpyChange_polytropicExpansion() {
            air.setTemperatureAndPressure(1200.0, 10 * P_STD);

            air.setEnthalpyChange(-200000.0, 0.9);

            assertEquals(1027.7367, air.getTemperature(), 1e-3);
            assertEquals(505089.09, air.getPressure(), 1e-1);
        }

        @Test
        @DisplayName("set_Δh con extracción de trabajo: ηp divide el salto de φ al calcular P")
        void setEnthalpyChange_extractionBranchDividesByEfficiency() {
            // ARRANGE
            air.setTemperatureAndPressure(1200.0, 10 * P_STD);
            double p0 = air.getPressure();
            double phi0 = air.getEntropyComplement();
            double r = air.getGasConstant();

            // ACT
            air.setEnthalpyChange(-200000.0, 0.8);

            // ASSERT
            double deltaPhi = air.getEntropyComplement() - phi0;
            assertTrue(deltaPhi < 0.0);
            assertEquals(p0 * Math.exp(deltaPhi / (0.8 * r)), air.getPressure(), 1e-6);
            assertTrue(air.getPressure() < p0 * Math.exp(0.8 * deltaPhi / r),
                    "Con pérdidas la caída de presión debe ser mayor que la isentrópica.");
        }

        @Test
        @DisplayName("set_Δh con ηp fuera de (0, 1] se rechaza sin modificar el estado")
        void setEnthalpyChange_invalidEfficiency() {
            GasSnapshot before = air.snapshot();

            InvalidPropertyAssignmentException ex = assertThrows(InvalidPropertyAssignmentException.class,
                    () -> air.setEnthalpyChange(1000.0, 1.5));

            assertThat(ex.getMessage()).contains("eficiencia politrópica");
            assertEquals(before, air.snapshot());
        }

        @Test
        @DisplayName("Sin iteraciones suficientes lanza ConvergenceException con el último iterado")
        void setEnthalpy_withoutEnoughIterations() {
            SolverConfig tight = SolverConfig.defaults().withEnthalpyMaxIterations(1);
            GasState gas = new GasState(registry, tight);

            ConvergenceException ex = assertThrows(ConvergenceException.class, () -> gas.setEnthalpy(0.0));

            assertEquals("setEnthalpy", ex.getOperation());
            assertEquals(1, ex.getIterations());
            assertTrue(ex.getResidual() > ex.getTolerance());
            assertEquals(gas.getTemperature(), ex.getLastState().temperature());
            assertNotEquals(T_STD, gas.getTemperature(), "El gas queda en el último iterado.");
        }
    }

    // --------------------------------------------------------------------------
    // Acceso por propiedad
    // --------------------------------------------------------------------------

    @Nested
    @DisplayName("Acceso por nombre de propiedad")
    class PropertyDispatch {

        @Test
        @DisplayName("T, P y h son asignables")
        void writableProperties() {
            air.set(GasProperty.TEMPERATURE, 700.0);
            air.set(GasProperty.PRESSURE, 3e5);
            assertEquals(700.0, air.get(GasProperty.TEMPERATURE));
            assertEquals(3e5, air.get(GasProperty.PRESSURE));

            air.set(GasProperty.ENTHALPY, 0.0);
            assertEquals(302.463, air.getTemperature(), 1e-3);
        }

        @ParameterizedTest
        @EnumSource(value = GasProperty.class, names = {"TEMPERATURE", "PRESSURE", "ENTHALPY"}, mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("Las propiedades derivadas son de solo lectura")
        void readOnlyProperties(GasProperty property) {
            GasSnapshot before = air.snapshot();

            InvalidPropertyAssignmentException ex = assertThrows(InvalidPropertyAssignmentException.class,
                    () -> air.set(property, 1.0));

            assertFalse(property.isWritable());
            assertThat(ex.getMessage()).contains(property.name());
            assertEquals(before, air.snapshot());
        }

        @Test
        @DisplayName("get coincide con los getters tipados")
        void getMatchesTypedGetters() {
            assertEquals(air.getGamma(), air.get(GasProperty.GAMMA));
            assertEquals(air.getDensity(), air.get(GasProperty.DENSITY));
            assertEquals(air.getEntropy(), air.get(GasProperty.ENTROPY));
            assertEquals(air.getSpecificHeatDerivative(), air.get(GasProperty.SPECIFIC_HEAT_DERIVATIVE));
            assertEquals(air.getMolecularWeight(), air.get(GasProperty.MOLECULAR_WEIGHT));
        }
    }

    @Test
    @DisplayName("copy: estado independiente que comparte el registro")
    void copy_isIndependent() {
        // ARRANGE
        air.setTemperatureAndPressure(450.0, 2e5);

        // ACT
        GasState copy = air.copy();
        copy.setTemperature(900.0);
        copy.setMassFractions(combustionProducts());

        // ASSERT
        assertSame(air.getRegistry(), copy.getRegistry());
        assertEquals(450.0, air.getTemperature());
        assertEquals(1.0, air.getMassFractions()[registry.indexOf("Air")]);
        assertEquals(2e5, copy.getPressure());
    }
}
