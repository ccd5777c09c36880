package com.configline.backend.proposal;

import com.configline.backend.proposal.ProposalDtos.*;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class ProposalController {

    private static final String USER_HEADER = "X-User-Email";

    private final ProposalService service;

    public ProposalController(ProposalService service) {
        this.service = service;
    }

    @PostMapping("/projects/{projectId}/configs/{name}/proposals")
    @ResponseStatus(HttpStatus.CREATED)
    public ConfigProposalView createConfigProposal(
            @PathVariable String projectId,
            @PathVariable String name,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody CreateConfigProposalRequest req
    ) {
        return service.createConfigProposal(projectId, name, user, req);
    }

    @GetMapping("/projects/{projectId}/configs/{name}/proposals")
    public List<ConfigProposalView> listConfigProposals(@PathVariable String projectId, @PathVariable String name,
                                                        @RequestHeader(USER_HEADER) String user) {
        return service.listConfigProposals(projectId, name, user);
    }

    @GetMapping("/config-proposals/{id}")
    public ConfigProposalView getConfigProposal(@PathVariable UUID id, @RequestHeader(USER_HEADER) String user) {
        return service.getConfigProposal(id, user);
    }

    @PostMapping("/config-proposals/{id}/approve")
    public ConfigProposalView approveConfigProposal(@PathVariable UUID id, @RequestHeader(USER_HEADER) String user) {
        return service.approveConfigProposal(id, user);
    }

    @PostMapping("/config-proposals/{id}/reject")
    public ConfigProposalView rejectConfigProposal(@PathVariable UUID id, @RequestHeader(USER_HEADER) String user) {
        return service.rejectConfigProposal(id, user);
    }

    @PostMapping("/projects/{projectId}/configs/{name}/variants/{environmentId}/proposals")
    @ResponseStatus(HttpStatus.CREATED)
    public VariantProposalView createVariantProposal(
            @PathVariable String projectId,
            @PathVariable String name,
            @PathVariable String environmentId,
            @RequestHeader(USER_HEADER) String user,
            @RequestBody CreateVariantProposalRequest req
    ) {
        return service.createVariantProposal(projectId, name, environmentId, user, req);
    }

    @GetMapping("/projects/{projectId}/configs/{name}/variants/{environmentId}/proposals")
    public List<VariantProposalView> listVariantProposals(
            @PathVariable String projectId,
            @PathVariable String name,
            @PathVariable String environmentId,
            @RequestHeader(USER_HEADER) String user
    ) {
        return service.listVariantProposals(projectId, name, environmentId, user);
    }

    @GetMapping("/config-variant-proposals/{id}")
    public VariantProposalView getVariantProposal(@PathVariable UUID id, @RequestHeader(USER_HEADER) String user) {
        return service.getVariantProposal(id, user);
    }

    @PostMapping("/config-variant-proposals/{id}/approve")
    public VariantProposalView approveVariantProposal(@PathVariable UUID id, @RequestHeader(USER_HEADER) String user) {
        return service.approveVariantProposal(id, user);
    }

    @PostMapping("/config-variant-proposals/{id}/reject")
    public VariantProposalView rejectVariantProposal(@PathVariable UUID id, @RequestHeader(USER_HEADER) String user) {
        return service.rejectVariantProposal(id, user);
    }
}
