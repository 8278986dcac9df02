package com.billsync.share;

import com.billsync.protocol.share.BatchStatusRequest;
import com.billsync.protocol.share.ShareChange;
import com.billsync.protocol.share.ShareCreated;
import com.billsync.protocol.share.ShareRequest;
import com.billsync.protocol.share.ShareSnapshot;
import com.billsync.protocol.share.ShareStatus;
import com.billsync.protocol.share.ShareUpdated;
import com.billsync.protocol.share.ShareVersion;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/share")
public class ShareSessionController {

    private final ShareSessionService service;

    public ShareSessionController(ShareSessionService service) {
        this.service = service;
    }

    @PostMapping
    public Mono<ResponseEntity<ShareCreated>> create(@RequestBody ShareRequest request) {
        return service.create(request.ciphertext())
                .map(created -> ResponseEntity.status(HttpStatus.CREATED)
                        .cacheControl(CacheControl.noStore())
                        .body(created));
    }

    @PostMapping("/{shareId}")
    public Mono<ResponseEntity<ShareUpdated>> update(@PathVariable String shareId,
                                                     @RequestBody ShareRequest request) {
        return service.update(shareId, request.ciphertext(), request.updateToken())
                .map(updated -> ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(updated));
    }

    /**
     * 304 with no body when the caller's {@code ifNewerThan} already covers the stored version.
     */
    @GetMapping("/{shareId}")
    public Mono<ResponseEntity<ShareSnapshot>> fetch(@PathVariable String shareId,
                                                     @RequestParam(required = false) Long ifNewerThan) {
        return service.fetch(shareId, ifNewerThan)
                .map(snapshot -> ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(snapshot))
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_MODIFIED)
                        .cacheControl(CacheControl.noStore())
                        .<ShareSnapshot>build());
    }

    @PostMapping("/batch-status")
    public Mono<ResponseEntity<List<ShareStatus>>> batchStatus(@RequestBody BatchStatusRequest request) {
        return service.statuses(request.shareIds())
                .collectList()
                .map(statuses -> ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(statuses));
    }

    @PostMapping("/batch-check")
    public Mono<ResponseEntity<List<ShareChange>>> batchCheck(@RequestBody List<ShareVersion> known) {
        return service.changedSince(known)
                .collectList()
                .map(changes -> ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(changes));
    }
}
