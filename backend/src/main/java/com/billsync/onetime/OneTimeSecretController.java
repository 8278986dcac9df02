package com.billsync.onetime;

import com.billsync.protocol.onetime.OneTimeKeyCreated;
import com.billsync.protocol.onetime.OneTimeKeyPayload;
import com.billsync.protocol.onetime.OneTimeKeyRequest;
import com.billsync.protocol.onetime.OneTimeKeyStatus;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/onetime-key")
public class OneTimeSecretController {

    private final OneTimeSecretService service;

    public OneTimeSecretController(OneTimeSecretService service) {
        this.service = service;
    }

    @PostMapping
    public Mono<ResponseEntity<OneTimeKeyCreated>> create(@RequestBody OneTimeKeyRequest request) {
        return service.create(request.encryptedPayload())
                .map(keyId -> ResponseEntity.status(HttpStatus.CREATED)
                        .cacheControl(CacheControl.noStore())
                        .body(new OneTimeKeyCreated(keyId)));
    }

    /**
     * DESTRUCTIVE: the secret is deleted before the response is written.
     */
    @GetMapping("/{keyId}")
    public Mono<ResponseEntity<OneTimeKeyPayload>> consume(@PathVariable String keyId) {
        return service.consume(keyId)
                .map(payload -> ResponseEntity.ok()
                        .cacheControl(CacheControl.noStore())
                        .body(new OneTimeKeyPayload(payload)));
    }

    @GetMapping("/{keyId}/status")
    public Mono<ResponseEntity<OneTimeKeyStatus>> status(@PathVariable String keyId) {
        return service.peek(keyId)
                .thenReturn(ResponseEntity.ok()
                        .cacheControl(CacheControl.noStore())
                        .body(OneTimeKeyStatus.available()));
    }
}
