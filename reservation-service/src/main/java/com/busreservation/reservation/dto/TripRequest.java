package com.busreservation.reservation.dto;

import com.busreservation.reservation.constants.ValidationMessages;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TripRequest {

    @NotBlank(message = ValidationMessages.BUS_ID_REQUIRED)
    String busId;

    @NotBlank(message = ValidationMessages.ROUTE_ID_REQUIRED)
    String routeId;

    @NotNull(message = ValidationMessages.SERVICE_DATE_REQUIRED)
    LocalDate serviceDate;

    @NotNull(message = ValidationMessages.DEPARTURE_TIME_REQUIRED)
    LocalTime departureTime;

    @NotNull(message = ValidationMessages.ARRIVAL_TIME_REQUIRED)
    LocalTime arrivalTime;

    @NotNull(message = ValidationMessages.PRICE_REQUIRED)
    @DecimalMin(value = "0.0", message = ValidationMessages.PRICE_NON_NEGATIVE)
    BigDecimal price;
}
