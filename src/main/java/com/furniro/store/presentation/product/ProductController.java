package com.furniro.store.presentation.product;

import com.furniro.store.application.product.ProductService;
import com.furniro.store.application.product.dto.ProductDetailResult;
import com.furniro.store.application.product.dto.ProductListResult;
import com.furniro.store.presentation.product.mapper.ProductMapper;
import com.furniro.store.presentation.product.request.ProductRequest;
import com.furniro.store.presentation.product.response.PriceResponse;
import com.furniro.store.presentation.product.response.ProductDetailResponse;
import com.furniro.store.presentation.product.response.ProductListResponse;
import com.furniro.store.presentation.product.response.ProductSummaryResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * ProductController - Presentation 계층
 * 상품 API 요청 처리
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;
    private final ProductMapper productMapper;

    public ProductController(ProductService productService, ProductMapper productMapper) {
        this.productService = productService;
        this.productMapper = productMapper;
    }

    /**
     * GET /products - 상품 목록 조회
     */
    @GetMapping
    public ResponseEntity<ProductListResponse> getProducts(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String categories,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(required = false) String order,
            @RequestParam(name = "min_price", required = false) BigDecimal minPrice,
            @RequestParam(name = "max_price", required = false) BigDecimal maxPrice) {
        ProductListResult result = productService.getProducts(
                productMapper.toProductListQuery(page, limit, categories, sortBy, order, minPrice, maxPrice));
        return ResponseEntity.ok(productMapper.toProductListResponse(result));
    }

    /**
     * GET /products/search - 상품명/카테고리명 검색
     */
    @GetMapping("/search")
    public ResponseEntity<List<ProductSummaryResponse>> search(@RequestParam(required = false) String query) {
        return ResponseEntity.ok(productMapper.toProductSummaryResponses(productService.search(query)));
    }

    @GetMapping("/min-price")
    public ResponseEntity<PriceResponse> getMinPrice() {
        return ResponseEntity.ok(new PriceResponse(productService.getMinPrice()));
    }

    @GetMapping("/max-price")
    public ResponseEntity<PriceResponse> getMaxPrice() {
        return ResponseEntity.ok(new PriceResponse(productService.getMaxPrice()));
    }

    /**
     * GET /products/{productId} - 상품 상세 조회
     */
    @GetMapping("/{productId:\\d+}")
    public ResponseEntity<ProductDetailResponse> getProduct(@PathVariable Long productId) {
        ProductDetailResult result = productService.getProduct(productId);
        return ResponseEntity.ok(productMapper.toProductDetailResponse(result));
    }

    /**
     * POST /products - 상품 등록
     */
    @PostMapping
    public ResponseEntity<ProductDetailResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        ProductDetailResult result = productService.createProduct(productMapper.toProductCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(productMapper.toProductDetailResponse(result));
    }

    /**
     * PATCH /products/{productId} - 상품 수정
     */
    @PatchMapping("/{productId:\\d+}")
    public ResponseEntity<ProductDetailResponse> updateProduct(
            @PathVariable Long productId,
            @Valid @RequestBody ProductRequest request) {
        ProductDetailResult result = productService.updateProduct(productId, productMapper.toProductCommand(request));
        return ResponseEntity.ok(productMapper.toProductDetailResponse(result));
    }

    /**
     * DELETE /products/{productId} - 상품 삭제 (소프트 삭제)
     */
    @DeleteMapping("/{productId:\\d+}")
    public ResponseEntity<Void> deleteProduct(@PathVariable Long productId) {
        productService.deleteProduct(productId);
        return ResponseEntity.noContent().build();
    }
}
