/* (C)2026 */
package com.ammann.analytics.exception;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsInvalidInputToBadRequest()
    {
        Response response = handler.toResponse(InvalidInputException.insufficientData(5, 3));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INVALID_INPUT");
        assertThat(body.message).contains("at least 5");
        assertThat(body.status).isEqualTo(400);
        assertThat(body.path).isNull();
        assertThat(body.timestamp).isNotNull();
    }

    @Test
    void mapsDegenerateSampleToUnprocessableEntity()
    {
        Response response = handler.toResponse(new DegenerateSampleException(5.0));

        assertThat(response.getStatus()).isEqualTo(422);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("DEGENERATE_SAMPLE");
        assertThat(body.message).contains("5.0");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
    }

    @Test
    void keepsStatusOfOtherClientErrors()
    {
        Response response = handler.toResponse(new BadRequestException("malformed JSON"));

        assertThat(response.getStatus()).isEqualTo(400);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("BAD_REQUEST");
    }

    @Test
    void mapsUnhandledTo500WithoutLeakingDetails()
    {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).doesNotContain("boom");
    }

    @Test
    void includesRequestPathWhenAvailable()
    {
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/v1/analysis");
        handler.uriInfo = uriInfo;

        Response response = handler.toResponse(new DegenerateSampleException(1.0));

        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isEqualTo("/api/v1/analysis");
    }
}
