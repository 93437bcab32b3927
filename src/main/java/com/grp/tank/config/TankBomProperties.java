package com.grp.tank.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * BOM engine settings ({@code tank.bom.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "tank.bom")
public class TankBomProperties {

    /**
     * Spare-stock multiplier applied to every bolt quantity, rounded up. The bundled reference quantities
     * already include spares, hence 1.00.
     */
    @NotNull
    @DecimalMin("1.0")
    private BigDecimal spareFactor = BigDecimal.ONE;

    /** USD to local currency, used when a request does not carry its own rate. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal defaultExchangeRate = new BigDecimal("3.75");

    @NotBlank
    private String localCurrency = "SAR";

    @NotBlank
    private String catalogLocation = "classpath:data/catalog.json";

    @NotBlank
    private String lookupTablesLocation = "classpath:data/lookup-tables.json";

    @Valid
    private Demo demo = new Demo();

    @Data
    public static class Demo {
        private boolean enabled; // print a reference BOM at startup
    }
}
