package com.farmket.marketplace.service;

import com.farmket.marketplace.dto.AccountRequest;
import com.farmket.marketplace.dto.ProductListRow;
import com.farmket.marketplace.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
class ProductAdminServiceTest {

    @Autowired
    private ProductAdminService productAdminService;
    @Autowired
    private CategoryAdminService categoryAdminService;
    @Autowired
    private UserAdminService userAdminService;
    @Autowired
    private ProductService productService;
    @Autowired
    private CategoryService categoryService;
    @Autowired
    private UserService userService;
    @Autowired
    private SettingsService settingsService;

    @MockBean
    private AuditService auditService;

    private Category fruit;
    private Category citrus;
    private Category dairy;
    private Product lemons;

    @BeforeEach
    void setUp() {
        SellerProfile orchard = seller("orchard@farm.org", "Sunny Orchard", "Olive");
        SellerProfile creamery = seller("milk@dairy.org", "Valley Creamery", "Milo");

        fruit = category("Fruit", null);
        citrus = category("Citrus", fruit);
        dairy = category("Dairy", null);

        lemons = product(orchard, citrus, "Meyer Lemons", "LEM-1", "4.00", "3.50", false, ProductStatus.AVAILABLE);
        product(orchard, fruit, "Gala Apples", "APL-1", "2.20", null, true, ProductStatus.AVAILABLE);
        product(creamery, dairy, "Whole Milk", "MLK-1", "1.10", null, true, ProductStatus.OUT_OF_STOCK);
    }

    private SellerProfile seller(String email, String businessName, String firstName) {
        User user = userService.createUser(AccountRequest.builder()
                .email(email)
                .userType(UserType.SELLER)
                .firstName(firstName)
                .build());
        return userService.createSellerProfile(user.getId(), businessName);
    }

    private Category category(String name, Category parent) {
        Category c = new Category();
        c.setName(name);
        c.setParent(parent);
        return categoryService.save(c);
    }

    private Product product(SellerProfile seller, Category category, String name, String sku, String price,
            String discountPrice, boolean featured, ProductStatus status) {
        Product p = new Product();
        p.setSeller(seller);
        p.setCategory(category);
        p.setName(name);
        p.setSku(sku);
        p.setPrice(new BigDecimal(price));
        p.setDiscountPrice(discountPrice != null ? new BigDecimal(discountPrice) : null);
        p.setFeatured(featured);
        p.setStatus(status);
        return productService.save(p);
    }

    private List<String> names(List<ProductListRow> rows) {
        return rows.stream().map(ProductListRow::name).sorted().toList();
    }

    @Test
    void search_withoutArgumentsListsEverything() {
        assertEquals(List.of("Gala Apples", "Meyer Lemons", "Whole Milk"), names(productAdminService.search(null, null, null, null)));
    }

    @Test
    void search_matchesSellerBusinessNameAndEmail() {
        assertEquals(List.of("Gala Apples", "Meyer Lemons"), names(productAdminService.search("orchard", null, null, null)));
        assertEquals(List.of("Whole Milk"), names(productAdminService.search("DAIRY.ORG", null, null, null)));
    }

    @Test
    void search_matchesSkuAndSlug() {
        assertEquals(List.of("Meyer Lemons"), names(productAdminService.search("lem-1", null, null, null)));
        assertEquals(List.of("Gala Apples"), names(productAdminService.search("gala-apples", null, null, null)));
    }

    @Test
    void search_filtersByCategoryStatusAndFeatured() {
        assertEquals(List.of("Meyer Lemons"), names(productAdminService.search(null, citrus.getId(), null, null)));
        assertEquals(List.of("Whole Milk"), names(productAdminService.search(null, null, ProductStatus.OUT_OF_STOCK, null)));
        assertEquals(List.of("Gala Apples", "Whole Milk"), names(productAdminService.search(null, null, null, true)));
        assertEquals(List.of("Gala Apples"), names(productAdminService.search("a", null, ProductStatus.AVAILABLE, true)));
    }

    @Test
    void rows_carryDisplayColumns() {
        ProductListRow row = productAdminService.search("meyer", null, null, null).get(0);

        assertEquals("Sunny Orchard", row.sellerBusinessName());
        assertEquals("$3.50", row.finalPrice());
        assertEquals(ProductStatus.AVAILABLE, row.status());
        assertFalse(row.featured());
    }

    @Test
    void finalPrice_usesConfiguredCurrencySymbol() {
        assertEquals("$3.50", productAdminService.formatFinalPrice(lemons));
        assertEquals("Sunny Orchard", productAdminService.sellerBusinessName(lemons));

        settingsService.updateSetting(SettingsService.KEY_CURRENCY_SYMBOL, "€");

        assertEquals("€3.50", productAdminService.formatFinalPrice(lemons));
    }

    @Test
    void categorySearch_byNameAndParent() {
        assertEquals(List.of("Citrus"), categoryAdminService.search(null, fruit.getId()).stream().map(Category::getName).toList());
        assertEquals(List.of("Citrus", "Dairy", "Fruit"), categoryAdminService.search(null, null).stream().map(Category::getName).toList());
        assertEquals(List.of("Fruit"), categoryAdminService.search("FRU", null).stream().map(Category::getName).toList());
    }

    @Test
    void userSearch_byNameAndFlags() {
        assertEquals(List.of("milk@dairy.org"),
                userAdminService.search("milo", null, null, null).stream().map(User::getEmail).toList());
        assertEquals(2, userAdminService.search(null, false, true, UserType.SELLER).size());
        assertTrue(userAdminService.search(null, true, null, null).isEmpty());
    }
}
