package com.retailsentinel.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only reference data: the product catalog and the customer registry.
 *
 * <p>
 * Built once at startup; lookups never mutate it, so it is safe to share
 * between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReferenceCatalog implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final ReferenceCatalog EMPTY = new ReferenceCatalog(
            Collections.emptyList(), Collections.emptyList());

    private final Map<String, ProductRecord> products;
    private final Map<String, CustomerRecord> customers;

    public ReferenceCatalog(Collection<ProductRecord> products, Collection<CustomerRecord> customers) {
        Objects.requireNonNull(products, "products must not be null");
        Objects.requireNonNull(customers, "customers must not be null");
        Map<String, ProductRecord> p = new LinkedHashMap<>();
        for (ProductRecord product : products) {
            p.put(product.getSku(), product);
        }
        Map<String, CustomerRecord> c = new LinkedHashMap<>();
        for (CustomerRecord customer : customers) {
            c.put(customer.getCustomerId(), customer);
        }
        this.products = Collections.unmodifiableMap(p);
        this.customers = Collections.unmodifiableMap(c);
    }

    /**
     * @return a catalog with no products and no customers
     */
    public static ReferenceCatalog empty() {
        return EMPTY;
    }

    public Optional<ProductRecord> product(String sku) {
        return sku == null ? Optional.empty() : Optional.ofNullable(products.get(sku));
    }

    public Optional<CustomerRecord> customer(String customerId) {
        return customerId == null ? Optional.empty() : Optional.ofNullable(customers.get(customerId));
    }

    public int productCount() {
        return products.size();
    }

    public int customerCount() {
        return customers.size();
    }

    @Override
    public String toString() {
        return "ReferenceCatalog{products=" + products.size() + ", customers=" + customers.size() + '}';
    }
}
