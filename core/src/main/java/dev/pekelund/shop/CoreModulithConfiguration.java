package dev.pekelund.shop;

import org.springframework.modulith.Modulithic;

@Modulithic(systemName = "storefront-core")
public class CoreModulithConfiguration {
}
