/* (C)2026 */
package com.ammann.analytics.resource;

import com.ammann.analytics.dto.AnalysisReportDTO;
import com.ammann.analytics.dto.AnalysisRequestDTO;
import com.ammann.analytics.dto.BatchAnalysisRequestDTO;
import com.ammann.analytics.dto.BatchAnalysisResultDTO;
import com.ammann.analytics.exception.InvalidInputException;
import com.ammann.analytics.model.AnalysisOptions;
import com.ammann.analytics.model.AnalysisReport;
import com.ammann.analytics.model.ReferenceSamples;
import com.ammann.analytics.properties.ApiProperties;
import com.ammann.analytics.service.BatchAnalysisService;
import com.ammann.analytics.service.SampleAnalysisService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST resource for analysing numeric samples.
 *
 * <p>Accepts already parsed measurement series as JSON and returns the descriptive
 * statistics, normality verdicts and outlier findings. Parsing text files and rendering
 * workbooks or charts is left to clients.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Analysis API", description = "Descriptive statistics, normality tests and outlier detection")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    @Inject
    SampleAnalysisService sampleAnalysisService;

    @Inject
    BatchAnalysisService batchAnalysisService;

    @POST
    @Path(ApiProperties.Analysis.BASE)
    @Operation(
            summary = "Analyse a sample",
            description = "Computes descriptive statistics, confidence intervals, normality criteria and outlier criteria for one sample"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Sample analysed",
                    content = @Content(schema = @Schema(implementation = AnalysisReportDTO.class))),
            @APIResponse(responseCode = "400", description = "Fewer than 5 values, non-finite values or invalid options"),
            @APIResponse(responseCode = "422", description = "All values are identical"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyze(AnalysisRequestDTO request) {
        if (request == null) {
            throw InvalidInputException.invalidParameter("body", null, "a JSON object with 'values'");
        }
        LOG.debugf("Analysis request: label=%s, values=%d", request.label(),
                request.values() == null ? 0 : request.values().size());

        AnalysisOptions options = request.toOptions(sampleAnalysisService.defaultOptions());
        AnalysisReport report = sampleAnalysisService.analyze(request.toSample(), options);

        return Response.ok(AnalysisReportDTO.from(report)).build();
    }

    @POST
    @Path(ApiProperties.Analysis.BATCH)
    @Operation(
            summary = "Analyse several samples",
            description = "Analyses every sample with the same options. A sample that cannot be analysed yields a failed entry without affecting the others"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Batch analysed",
                    content = @Content(schema = @Schema(implementation = BatchAnalysisResultDTO.class))),
            @APIResponse(responseCode = "400", description = "No samples, too many samples or invalid options"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyzeBatch(BatchAnalysisRequestDTO request) {
        if (request == null || request.samples() == null) {
            throw InvalidInputException.insufficientData(1, 0);
        }
        LOG.debugf("Batch analysis request: %d samples", request.samples().size());

        AnalysisOptions options = request.toOptions(sampleAnalysisService.defaultOptions());
        List<BatchAnalysisService.LabelledValues> inputs = request.samples().stream()
                .map(sample -> sample == null
                        ? new BatchAnalysisService.LabelledValues(null, null)
                        : sample.toLabelledValues())
                .toList();

        var result = BatchAnalysisResultDTO.from(batchAnalysisService.analyzeValues(inputs, options));

        LOG.infof("Batch analysis returned %d of %d samples analysed", result.succeeded(), result.total());
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Analysis.REFERENCE)
    @Operation(
            summary = "Analyse the reference samples",
            description = "Analyses the two bundled measurement series (48 and 25 values) with the configured defaults"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Reference samples analysed",
                    content = @Content(schema = @Schema(implementation = BatchAnalysisResultDTO.class))),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyzeReference() {
        var entries = batchAnalysisService.analyzeAll(ReferenceSamples.all(), sampleAnalysisService.defaultOptions());
        return Response.ok(BatchAnalysisResultDTO.from(entries)).build();
    }
}
