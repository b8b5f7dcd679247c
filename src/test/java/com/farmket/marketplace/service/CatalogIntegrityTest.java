package com.farmket.marketplace.service;

import com.farmket.marketplace.dto.AccountRequest;
import com.farmket.marketplace.exception.UniquenessViolationException;
import com.farmket.marketplace.model.*;
import com.farmket.marketplace.repository.CategoryRepository;
import com.farmket.marketplace.repository.ProductImageRepository;
import com.farmket.marketplace.repository.ProductRepository;
import com.farmket.marketplace.repository.SellerProfileRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@SpringBootTest
@Transactional
class CatalogIntegrityTest {

    @Autowired
    private ProductService productService;

    @Autowired
    private CategoryService categoryService;

    @Autowired
    private UserService userService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private ProductImageRepository imageRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private SellerProfileRepository sellerProfileRepository;

    @Autowired
    private EntityManager entityManager;

    @MockBean
    private AuditService auditService; // Mock audit to keep logs clean

    private SellerProfile createSeller(String email, String businessName) {
        User user = userService.createUser(AccountRequest.builder()
                .email(email)
                .userType(UserType.SELLER)
                .firstName("Grower")
                .build());
        return userService.createSellerProfile(user.getId(), businessName);
    }

    private Category createCategory(String name, Category parent) {
        Category category = new Category();
        category.setName(name);
        category.setParent(parent);
        return categoryService.save(category);
    }

    private Product createProduct(SellerProfile seller, Category category, String name, String sku) {
        Product p = new Product();
        p.setSeller(seller);
        p.setCategory(category);
        p.setName(name);
        p.setSku(sku);
        p.setPrice(new BigDecimal("3.50"));
        p.setStockQuantity(10);
        return productService.save(p);
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void productsWithSameName_getSuffixedSlugsInCreationOrder() {
        SellerProfile seller = createSeller("tomatoes@farm.org", "Tomato Hill");
        Category veg = createCategory("Vegetables", null);

        Product first = createProduct(seller, veg, "Organic Tomatoes", "TOM-1");
        Product second = createProduct(seller, veg, "Organic Tomatoes", "TOM-2");
        Product third = createProduct(seller, veg, "organic  tomatoes!", "TOM-3");

        Assertions.assertEquals("organic-tomatoes", first.getSlug());
        Assertions.assertEquals("organic-tomatoes-1", second.getSlug());
        Assertions.assertEquals("organic-tomatoes-2", third.getSlug());
        Assertions.assertEquals(second.getId(), productService.findBySlug("organic-tomatoes-1").getId());
    }

    @Test
    void resavingProduct_keepsItsSlug() {
        SellerProfile seller = createSeller("basil@farm.org", "Basil Barn");
        Category herbs = createCategory("Herbs", null);
        Product basil = createProduct(seller, herbs, "Sweet Basil", "BAS-1");

        basil.setPrice(new BigDecimal("2.75"));
        basil.setStockQuantity(0);
        Product resaved = productService.save(basil);
        Assertions.assertEquals("sweet-basil", resaved.getSlug());

        // A cleared slug is re-derived without colliding with the row itself
        resaved.setSlug("");
        Assertions.assertEquals("sweet-basil", productService.save(resaved).getSlug());
    }

    @Test
    void manualProductSlug_isKept() {
        SellerProfile seller = createSeller("kale@farm.org", "Kale Co");
        Category greens = createCategory("Greens", null);

        Product p = new Product();
        p.setSeller(seller);
        p.setCategory(greens);
        p.setName("Curly Kale");
        p.setSlug("kale-of-the-week");
        p.setSku("KAL-1");
        p.setPrice(new BigDecimal("1.99"));

        Assertions.assertEquals("kale-of-the-week", productService.save(p).getSlug());
    }

    @Test
    void productStatusAndStock_areIndependent() {
        SellerProfile seller = createSeller("leek@farm.org", "Leek Lane");
        Category veg = createCategory("Alliums", null);
        Product leeks = createProduct(seller, veg, "Leeks", "LEE-1");

        leeks.setStockQuantity(0);
        Product saved = productService.save(leeks);

        Assertions.assertEquals(ProductStatus.AVAILABLE, saved.getStatus());
        Assertions.assertFalse(saved.isInStock());
    }

    @Test
    void categoryWithoutSlug_getsOneFromItsName() {
        Category fruit = createCategory("Stone Fruit", null);

        Assertions.assertEquals("stone-fruit", fruit.getSlug());
        Assertions.assertTrue(categoryRepository.findBySlug("stone-fruit").isPresent());
    }

    @Test
    void deletingCategory_removesSubcategoriesAndTheirProducts() {
        SellerProfile seller = createSeller("roots@farm.org", "Root Cellar");
        Category root = createCategory("Produce", null);
        Category child = createCategory("Root Vegetables", root);
        Category grandchild = createCategory("Potatoes", child);
        Product potato = createProduct(seller, grandchild, "Yukon Gold", "POT-1");
        ProductImage image = productService.addImage(potato.getId(), "product_images/yukon.jpg", "Yukon Gold");
        Category unrelated = createCategory("Dairy", null);
        flushAndClear();

        Assertions.assertEquals(List.of(child.getId()),
                categoryService.subcategories(root.getId()).stream().map(Category::getId).toList());

        categoryService.delete(root.getId());
        flushAndClear();

        Assertions.assertTrue(categoryRepository.findById(child.getId()).isEmpty());
        Assertions.assertTrue(categoryRepository.findById(grandchild.getId()).isEmpty());
        Assertions.assertTrue(productRepository.findById(potato.getId()).isEmpty());
        Assertions.assertTrue(imageRepository.findById(image.getId()).isEmpty());
        Assertions.assertTrue(categoryRepository.findById(unrelated.getId()).isPresent());
    }

    @Test
    void deletingProduct_removesItsImages() {
        SellerProfile seller = createSeller("berries@farm.org", "Berry Patch");
        Category berries = createCategory("Berries", null);
        Product strawberries = createProduct(seller, berries, "Strawberries", "STR-1");
        productService.addImage(strawberries.getId(), "product_images/straw-1.jpg", "Punnet");
        productService.addImage(strawberries.getId(), "product_images/straw-2.jpg", "");
        flushAndClear();

        Assertions.assertEquals(2, productService.images(strawberries.getId()).size());

        productService.delete(strawberries.getId());
        flushAndClear();

        Assertions.assertEquals(0, imageRepository.countByProductId(strawberries.getId()));
        Assertions.assertTrue(categoryRepository.findById(berries.getId()).isPresent());
    }

    @Test
    void deletingSeller_removesProfileAndProducts() {
        SellerProfile seller = createSeller("honey@farm.org", "Bee Happy");
        Category pantry = createCategory("Pantry", null);
        Product honey = createProduct(seller, pantry, "Wildflower Honey", "HON-1");
        Long userId = seller.getId();
        flushAndClear();

        userService.delete(userId);
        flushAndClear();

        Assertions.assertTrue(sellerProfileRepository.findById(userId).isEmpty());
        Assertions.assertTrue(productRepository.findById(honey.getId()).isEmpty());
    }

    @Test
    void categoriesWhoseNamesSlugifyAlike_collide() {
        createCategory("Leafy Greens", null);

        Assertions.assertThrows(UniquenessViolationException.class, () -> createCategory("Leafy-Greens!", null));
    }

    @Test
    void duplicateSku_isAUniquenessViolation() {
        SellerProfile seller = createSeller("squash@farm.org", "Squash Court");
        Category veg = createCategory("Squash", null);
        createProduct(seller, veg, "Butternut", "SQ-1");

        Assertions.assertThrows(UniquenessViolationException.class,
                () -> createProduct(seller, veg, "Acorn", "SQ-1"));
    }
}
