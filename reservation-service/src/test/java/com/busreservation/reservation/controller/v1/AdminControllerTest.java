package com.busreservation.reservation.controller.v1;

import com.busreservation.reservation.dto.PageResponse;
import com.busreservation.reservation.dto.TripEntry;
import com.busreservation.reservation.service.BookingService;
import com.busreservation.reservation.service.TripLifecycleService;
import com.busreservation.reservation.service.TripService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AdminController.class)
@DisplayName("AdminController Web Tests")
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TripService tripService;

    @MockBean
    private TripLifecycleService tripLifecycleService;

    @MockBean
    private BookingService bookingService;

    @Test
    @DisplayName("Should list trips for a date")
    void findTrips_WithDate_ReturnsPage() throws Exception {
        LocalDate date = LocalDate.of(2026, 3, 5);
        when(tripService.findTrips(date, 0, 20)).thenReturn(PageResponse.<TripEntry>builder()
                .content(List.of(TripEntry.builder().tripId("TR1").status("CANCELLED").build()))
                .page(0).size(20).totalElements(1).totalPages(1).build());

        mockMvc.perform(get("/v1/admin/trips")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN")
                        .param("date", "2026-03-05"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].tripId").value("TR1"))
                .andExpect(jsonPath("$.content[0].status").value("CANCELLED"))
                .andExpect(jsonPath("$.totalElements").value(1));
    }

    @Test
    @DisplayName("Should refuse trip listing without the admin role")
    void findTrips_UserRole_Returns403() throws Exception {
        mockMvc.perform(get("/v1/admin/trips").header("X-User-Id", "user-1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        verify(tripService, never()).findTrips(any(), anyInt(), anyInt());
    }
}
