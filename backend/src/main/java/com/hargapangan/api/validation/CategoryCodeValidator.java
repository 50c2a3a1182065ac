package com.hargapangan.api.validation;

import com.hargapangan.domain.CommodityCategory;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class CategoryCodeValidator implements ConstraintValidator<CategoryCode, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || CommodityCategory.fromCode(value) != null;
    }
}
