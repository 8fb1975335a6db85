package com.furniro.store.presentation.store;

import com.furniro.store.application.store.StoreConfigService;
import com.furniro.store.presentation.store.mapper.StoreConfigMapper;
import com.furniro.store.presentation.store.request.UpdateStoreConfigRequest;
import com.furniro.store.presentation.store.response.StoreConfigResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * StoreConfigController - 스토어 설정 조회/수정
 */
@RestController
@RequestMapping("/store-config")
public class StoreConfigController {

    private final StoreConfigService storeConfigService;
    private final StoreConfigMapper storeConfigMapper;

    public StoreConfigController(StoreConfigService storeConfigService, StoreConfigMapper storeConfigMapper) {
        this.storeConfigService = storeConfigService;
        this.storeConfigMapper = storeConfigMapper;
    }

    @GetMapping
    public ResponseEntity<StoreConfigResponse> getConfig() {
        return ResponseEntity.ok(storeConfigMapper.toStoreConfigResponse(storeConfigService.getConfig()));
    }

    @PutMapping
    public ResponseEntity<StoreConfigResponse> updateConfig(@Valid @RequestBody UpdateStoreConfigRequest request) {
        return ResponseEntity.ok(storeConfigMapper.toStoreConfigResponse(
                storeConfigService.updateConfig(storeConfigMapper.toUpdateStoreConfigCommand(request))));
    }
}
