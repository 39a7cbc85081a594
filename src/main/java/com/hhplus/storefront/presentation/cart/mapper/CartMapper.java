package com.hhplus.storefront.presentation.cart.mapper;

import com.hhplus.storefront.application.cart.dto.AddCartItemCommand;
import com.hhplus.storefront.application.cart.dto.CartItemResult;
import com.hhplus.storefront.application.cart.dto.CartLineResult;
import com.hhplus.storefront.application.cart.dto.CartResult;
import com.hhplus.storefront.presentation.cart.request.AddCartItemRequest;
import com.hhplus.storefront.presentation.cart.response.AddCartItemResponse;
import com.hhplus.storefront.presentation.cart.response.CartLineResponse;
import com.hhplus.storefront.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Application Result DTO → Presentation Response DTO 변환
 */
@Component
public class CartMapper {

    public AddCartItemCommand toAddCartItemCommand(AddCartItemRequest request) {
        return AddCartItemCommand.builder()
                .itemType(request.getItemType())
                .itemId(request.getItemId())
                .quantity(request.getQuantity())
                .build();
    }

    public AddCartItemResponse toAddCartItemResponse(CartItemResult result) {
        return AddCartItemResponse.builder()
                .success(true)
                .cartItemId(result.getCartItemId())
                .itemType(result.getItemType())
                .itemId(result.getItemId())
                .quantity(result.getQuantity())
                .build();
    }

    public CartResponse toCartResponse(CartResult result) {
        return CartResponse.builder()
                .userId(result.getUserId())
                .items(result.getItems().stream()
                        .map(this::toCartLineResponse)
                        .collect(Collectors.toList()))
                .totalItems(result.getTotalItems())
                .totalAmount(result.getTotalAmount())
                .build();
    }

    private CartLineResponse toCartLineResponse(CartLineResult line) {
        return CartLineResponse.builder()
                .cartItemId(line.getCartItemId())
                .itemType(line.getItemType())
                .itemId(line.getItemId())
                .name(line.getName())
                .photo(line.getPhoto())
                .unitPrice(line.getUnitPrice())
                .quantity(line.getQuantity())
                .lineTotal(line.getLineTotal())
                .addedAt(line.getAddedAt())
                .build();
    }
}
