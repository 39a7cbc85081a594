package com.hhplus.storefront.presentation.catalog;

import com.hhplus.storefront.application.catalog.CatalogService;
import com.hhplus.storefront.presentation.catalog.response.CatalogItemResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CatalogController - Presentation 계층
 * 서비스/메뉴 상품 조회 API
 */
@RestController
@RequestMapping("/catalog")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * GET /catalog/{item_type} - 판매 중인 상품 목록 (service | menu)
     */
    @GetMapping("/{item_type}")
    public ResponseEntity<List<CatalogItemResponse>> getActiveItems(@PathVariable("item_type") String itemType) {
        List<CatalogItemResponse> items = catalogService.listActiveItems(itemType).stream()
                .map(CatalogItemResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(items);
    }

    /**
     * GET /catalog/{item_type}/{item_id} - 상품 상세 (판매 중지 상품 포함)
     */
    @GetMapping("/{item_type}/{item_id}")
    public ResponseEntity<CatalogItemResponse> getItemDetail(
            @PathVariable("item_type") String itemType,
            @PathVariable("item_id") Long itemId) {
        return ResponseEntity.ok(CatalogItemResponse.from(catalogService.getItemDetail(itemType, itemId)));
    }
}
