package org.learningjava.scalarstore.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import org.learningjava.scalarstore.application.usecase.LastLoggedUseCase;
import org.learningjava.scalarstore.application.usecase.LogScalarsUseCase;
import org.learningjava.scalarstore.application.usecase.QueryScalarsUseCase;
import org.learningjava.scalarstore.domain.model.ScalarsQuery;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.ExperimentScalarsResponse;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.GetScalarsRequest;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.LastLoggedRequest;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.LastLoggedResponse;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.LogBatchRequest;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.LogResponse;
import org.learningjava.scalarstore.infrastructure.adapter.in.web.dto.LogScalarRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/scalars")
public class ScalarsController {

    private final LogScalarsUseCase logScalars;
    private final QueryScalarsUseCase queryScalars;
    private final LastLoggedUseCase lastLogged;

    public ScalarsController(LogScalarsUseCase logScalars,
                             QueryScalarsUseCase queryScalars,
                             LastLoggedUseCase lastLogged) {
        this.logScalars = logScalars;
        this.queryScalars = queryScalars;
        this.lastLogged = lastLogged;
    }

    @PostMapping("/log/{projectId}/{experimentId}")
    public LogResponse log(@PathVariable String projectId,
                           @PathVariable String experimentId,
                           @Valid @RequestBody LogScalarRequest req) {
        return LogResponse.from(logScalars.logScalar(
                projectId, experimentId, req.step(), req.scalars(), req.tags()));
    }

    @PostMapping("/log_batch/{projectId}/{experimentId}")
    public LogResponse logBatch(@PathVariable String projectId,
                                @PathVariable String experimentId,
                                @Valid @RequestBody LogBatchRequest req) {
        return LogResponse.from(logScalars.logScalars(
                projectId, experimentId, req.scalars().stream().map(LogScalarRequest::toItem).toList()));
    }

    @GetMapping("/get/{projectId}")
    public List<ExperimentScalarsResponse> get(
            @PathVariable String projectId,
            @RequestParam(required = false) List<String> experimentIds,
            @RequestParam(required = false) Integer maxPoints,
            @RequestParam(defaultValue = "false") boolean returnTags,
            @RequestParam(required = false) String startTime,
            @RequestParam(required = false) String endTime
    ) {
        return query(projectId, new GetScalarsRequest(experimentIds, maxPoints, returnTags, startTime, endTime));
    }

    @PostMapping("/get/{projectId}")
    public List<ExperimentScalarsResponse> getPost(@PathVariable String projectId,
                                                   @RequestBody(required = false) GetScalarsRequest req) {
        return query(projectId, req == null ? new GetScalarsRequest(null, null, false, null, null) : req);
    }

    @GetMapping("/last_logged/{projectId}")
    public List<LastLoggedResponse> lastLogged(@PathVariable String projectId,
                                               @RequestParam(required = false) List<String> experimentIds) {
        return lastLogged.lastLogged(projectId, experimentIds).stream().map(LastLoggedResponse::from).toList();
    }

    @PostMapping("/last_logged/{projectId}")
    public List<LastLoggedResponse> lastLoggedPost(@PathVariable String projectId,
                                                   @RequestBody(required = false) LastLoggedRequest req) {
        return lastLogged(projectId, req == null ? null : req.experimentIds());
    }

    private List<ExperimentScalarsResponse> query(String projectId, GetScalarsRequest req) {
        ScalarsQuery q = new ScalarsQuery(
                projectId,
                req.experimentIds(),
                req.maxPoints(),
                Boolean.TRUE.equals(req.returnTags()),
                IsoTimes.parse(req.startTime(), "startTime"),
                IsoTimes.parse(req.endTime(), "endTime"));
        return queryScalars.getScalars(q).stream().map(ExperimentScalarsResponse::from).toList();
    }
}
