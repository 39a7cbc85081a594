package com.hhplus.storefront.application.catalog;

import com.hhplus.storefront.domain.catalog.*;
import com.hhplus.storefront.infrastructure.persistence.catalog.InMemoryCatalogItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogLookup 테스트")
class CatalogLookupTest {

    private InMemoryCatalogItemRepository<ServiceItem> serviceRepository;
    private InMemoryCatalogItemRepository<MenuItem> menuRepository;
    private CatalogLookup catalogLookup;

    @BeforeEach
    void setup() {
        serviceRepository = new InMemoryCatalogItemRepository<>(ItemType.SERVICE);
        menuRepository = new InMemoryCatalogItemRepository<>(ItemType.MENU);
        catalogLookup = new CatalogLookup(List.of(serviceRepository, menuRepository));
    }

    @Test
    @DisplayName("유형별 저장소로 위임 - 같은 ID라도 유형이 다르면 다른 상품")
    void testResolve_DispatchByType() {
        // Given
        serviceRepository.save(ServiceItem.builder().name("세차").originalPrice(100L).finalPrice(100L).build());
        menuRepository.save(MenuItem.builder().name("커피").originalPrice(50L).finalPrice(50L).build());

        // When
        Optional<CatalogItem> service = catalogLookup.resolve(ItemRef.of(ItemType.SERVICE, 1L));
        Optional<CatalogItem> menu = catalogLookup.resolve(ItemRef.of(ItemType.MENU, 1L));

        // Then
        assertTrue(service.isPresent());
        assertEquals("세차", service.get().getName());
        assertEquals(ItemType.SERVICE, service.get().getItemType());
        assertTrue(menu.isPresent());
        assertEquals("커피", menu.get().getName());
    }

    @Test
    @DisplayName("없는 상품은 empty")
    void testResolve_Missing() {
        assertTrue(catalogLookup.resolve(ItemRef.of(ItemType.MENU, 99L)).isEmpty());
    }

    @Test
    @DisplayName("INACTIVE 상품도 해석됨")
    void testResolve_InactiveStillResolvable() {
        menuRepository.save(MenuItem.builder().name("단종 메뉴").originalPrice(10L).finalPrice(10L)
                .status(CatalogItemStatus.INACTIVE).build());

        assertTrue(catalogLookup.resolve(ItemRef.of(ItemType.MENU, 1L)).isPresent());
        assertTrue(catalogLookup.listActive(ItemType.MENU).isEmpty());
    }

    @Test
    @DisplayName("getItem - 없으면 CatalogItemNotFoundException")
    void testGetItem_NotFound() {
        CatalogItemNotFoundException exception = assertThrows(CatalogItemNotFoundException.class,
                () -> catalogLookup.getItem(ItemRef.of(ItemType.SERVICE, 3L)));
        assertEquals(404, exception.getStatusCode());
    }

    @Test
    @DisplayName("유형 저장소 누락 시 생성 실패")
    void testConstructor_MissingRepository() {
        assertThrows(IllegalStateException.class, () -> new CatalogLookup(List.of(serviceRepository)));
    }

    @Test
    @DisplayName("유형 저장소 중복 등록 시 생성 실패")
    void testConstructor_DuplicateRepository() {
        InMemoryCatalogItemRepository<MenuItem> another = new InMemoryCatalogItemRepository<>(ItemType.MENU);
        assertThrows(IllegalStateException.class,
                () -> new CatalogLookup(List.of(serviceRepository, menuRepository, another)));
    }
}
