package com.tarterware.cvi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CviApplication
{
    public static void main(String[] args)
    {
        SpringApplication.run(CviApplication.class, args);
    }
}
